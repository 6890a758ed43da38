package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Independent timers for poll creation, the open/close/result transitions and the wager sync.
 */
@Service
@RequiredArgsConstructor
public class PollLifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollLifecycleScheduler.class);

    private final PickemRuntimeProperties runtimeProperties;
    private final PollLifecycleService pollLifecycleService;
    private final WagerLedgerReconciler wagerLedgerReconciler;

    @Scheduled(
            fixedDelayString = "${pickem.poll.creation-interval-ms:3600000}",
            initialDelayString = "${pickem.poll.initial-delay-ms:5000}"
    )
    public void createPolls() {
        if (!runtimeProperties.getPoll().isEnabled()) {
            return;
        }
        pollLifecycleService.createPendingPolls();
    }

    @Scheduled(
            fixedRateString = "${pickem.poll.lifecycle-interval-ms:10000}",
            initialDelayString = "${pickem.poll.initial-delay-ms:5000}"
    )
    public void processLifecycleTick() {
        if (!runtimeProperties.getPoll().isEnabled()) {
            return;
        }

        int opened = pollLifecycleService.openCreatedPolls().okCount();
        int closed = pollLifecycleService.closeDuePolls().okCount();
        int posted = pollLifecycleService.postResults().okCount();
        if (opened > 0 || closed > 0 || posted > 0) {
            log.info("Poll lifecycle tick: opened={}, closed={}, resultsPosted={}", opened, closed, posted);
        } else {
            log.debug("Poll lifecycle tick completed with no state changes");
        }
    }

    @Scheduled(
            fixedDelayString = "${pickem.poll.wager-sync-interval-ms:300000}",
            initialDelayString = "${pickem.poll.initial-delay-ms:5000}"
    )
    public void syncWagers() {
        if (!runtimeProperties.getPoll().isEnabled()) {
            return;
        }
        wagerLedgerReconciler.reconcileOpenPolls();
    }
}
