package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.ApiSource;
import com.pickem.provider.EventProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Periodic schedule ingestion and cross-source reconciliation.
 */
@Service
public class IngestionScheduler {

    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);

    private final PickemRuntimeProperties runtimeProperties;
    private final ScheduleIngestionService scheduleIngestionService;
    private final CrossSourceReconciler crossSourceReconciler;
    private final List<EventProvider> eventProviders;

    public IngestionScheduler(
            PickemRuntimeProperties runtimeProperties,
            ScheduleIngestionService scheduleIngestionService,
            CrossSourceReconciler crossSourceReconciler,
            List<EventProvider> eventProviders) {
        this.runtimeProperties = runtimeProperties;
        this.scheduleIngestionService = scheduleIngestionService;
        this.crossSourceReconciler = crossSourceReconciler;
        this.eventProviders = eventProviders;
    }

    @Scheduled(
            fixedDelayString = "${pickem.ingestion.interval-ms:300000}",
            initialDelayString = "${pickem.ingestion.initial-delay-ms:30000}"
    )
    public void scheduledIngestion() {
        if (!runtimeProperties.getIngestion().isEnabled()) {
            log.debug("Schedule ingestion skipped: disabled");
            return;
        }
        scheduleIngestionService.ingestSeason(runtimeProperties.getIngestion().getSeason());
    }

    @Scheduled(
            fixedDelayString = "${pickem.reconciliation.interval-ms:3600000}",
            initialDelayString = "${pickem.reconciliation.initial-delay-ms:60000}"
    )
    public void scheduledReconciliation() {
        if (!runtimeProperties.getReconciliation().isEnabled()) {
            log.debug("Reconciliation skipped: disabled");
            return;
        }
        runReconciliation();
    }

    /**
     * Maps teams first so that the game pass can resolve team references.
     */
    public BatchReport runReconciliation() {
        ApiSource source = runtimeProperties.getReconciliation().getSource();
        Optional<EventProvider> provider = findProvider(source);
        if (provider.isEmpty()) {
            log.warn("Reconciliation skipped: no event provider registered for {}", source);
            return new BatchReport("reconciliation").skipped("source:" + source, "no provider");
        }
        BatchReport report = new BatchReport("reconciliation");
        report.merge(crossSourceReconciler.reconcileTeams(provider.get()));
        report.merge(crossSourceReconciler.reconcileGames(provider.get(), runtimeProperties.getReconciliation().getYear()));
        return report;
    }

    Optional<EventProvider> findProvider(ApiSource source) {
        return eventProviders.stream().filter(provider -> provider.source() == source).findFirst();
    }
}
