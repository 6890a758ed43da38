package com.pickem.controller.dto;

import com.pickem.service.BatchReport;
import com.pickem.service.ItemResult;

import java.util.List;

public record SyncReportResponse(
        String task,
        int ok,
        int skipped,
        int failed,
        List<ItemResult> failures
) {
    public static SyncReportResponse from(String task, BatchReport report) {
        return new SyncReportResponse(
                task,
                report.okCount(),
                report.skippedCount(),
                report.failedCount(),
                report.getItems().stream().filter(item -> item.status() == ItemResult.Status.FAILED).toList()
        );
    }
}
