package com.pickem.service;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Per-item outcomes of one batch pass. Items never abort the batch; they land here instead.
 */
public class BatchReport {

    private final String operation;
    private final List<ItemResult> items = new ArrayList<>();

    public BatchReport(String operation) {
        this.operation = operation;
    }

    public BatchReport add(ItemResult result) {
        items.add(result);
        return this;
    }

    public BatchReport ok(String itemKey) {
        return add(ItemResult.ok(itemKey));
    }

    public BatchReport skipped(String itemKey, String reason) {
        return add(ItemResult.skipped(itemKey, reason));
    }

    public BatchReport failed(String itemKey, Throwable error) {
        return add(ItemResult.failed(itemKey, error));
    }

    public BatchReport merge(BatchReport other) {
        items.addAll(other.items);
        return this;
    }

    public String getOperation() {
        return operation;
    }

    public List<ItemResult> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Optional<ItemResult> find(String itemKey) {
        return items.stream().filter(item -> item.itemKey().equals(itemKey)).findFirst();
    }

    public int okCount() {
        return count(ItemResult.Status.OK);
    }

    public int skippedCount() {
        return count(ItemResult.Status.SKIPPED);
    }

    public int failedCount() {
        return count(ItemResult.Status.FAILED);
    }

    public boolean hasWork() {
        return okCount() > 0 || failedCount() > 0;
    }

    public void logSummary(Logger log) {
        if (!hasWork() && skippedCount() == 0) {
            log.debug("{}: nothing to do", operation);
            return;
        }
        log.info("{}: ok={}, skipped={}, failed={}", operation, okCount(), skippedCount(), failedCount());
        for (ItemResult item : items) {
            if (item.status() == ItemResult.Status.FAILED) {
                log.warn("{}: {} failed: {}", operation, item.itemKey(), item.detail());
            } else if (item.status() == ItemResult.Status.SKIPPED) {
                log.debug("{}: {} skipped: {}", operation, item.itemKey(), item.detail());
            }
        }
    }

    private int count(ItemResult.Status status) {
        return (int) items.stream().filter(item -> item.status() == status).count();
    }

    @Override
    public String toString() {
        return operation + "[ok=" + okCount() + ", skipped=" + skippedCount() + ", failed=" + failedCount() + "]";
    }
}
