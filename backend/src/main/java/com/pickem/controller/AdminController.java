package com.pickem.controller;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.controller.dto.SyncReportResponse;
import com.pickem.service.BatchReport;
import com.pickem.service.IngestionScheduler;
import com.pickem.service.PollLifecycleService;
import com.pickem.service.ScheduleIngestionService;
import com.pickem.service.TeamIngestionService;
import com.pickem.service.WagerLedgerReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Manual triggers for the periodic tasks.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final ScheduleIngestionService scheduleIngestionService;
    private final TeamIngestionService teamIngestionService;
    private final IngestionScheduler ingestionScheduler;
    private final PollLifecycleService pollLifecycleService;
    private final WagerLedgerReconciler wagerLedgerReconciler;
    private final PickemRuntimeProperties runtimeProperties;

    public AdminController(
            ScheduleIngestionService scheduleIngestionService,
            TeamIngestionService teamIngestionService,
            IngestionScheduler ingestionScheduler,
            PollLifecycleService pollLifecycleService,
            WagerLedgerReconciler wagerLedgerReconciler,
            PickemRuntimeProperties runtimeProperties) {
        this.scheduleIngestionService = scheduleIngestionService;
        this.teamIngestionService = teamIngestionService;
        this.ingestionScheduler = ingestionScheduler;
        this.pollLifecycleService = pollLifecycleService;
        this.wagerLedgerReconciler = wagerLedgerReconciler;
        this.runtimeProperties = runtimeProperties;
    }

    @PostMapping("/sync/{task}")
    public ResponseEntity<SyncReportResponse> runTask(@PathVariable String task) {
        log.info("Manual sync requested: {}", task);
        BatchReport report = switch (task) {
            case "schedule" -> scheduleIngestionService.ingestSeason(runtimeProperties.getIngestion().getSeason());
            case "teams" -> teamIngestionService.refreshTeams();
            case "reconcile" -> ingestionScheduler.runReconciliation();
            case "polls" -> new BatchReport("polls")
                    .merge(pollLifecycleService.createPendingPolls())
                    .merge(pollLifecycleService.openCreatedPolls())
                    .merge(pollLifecycleService.closeDuePolls());
            case "wagers" -> wagerLedgerReconciler.reconcileOpenPolls();
            case "results" -> pollLifecycleService.postResults();
            default -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown sync task: " + task);
        };
        return ResponseEntity.ok(SyncReportResponse.from(task, report));
    }
}
