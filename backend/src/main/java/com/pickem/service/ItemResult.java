package com.pickem.service;

/**
 * Outcome of processing one record within a batch.
 */
public record ItemResult(String itemKey, Status status, String detail) {

    public enum Status {
        OK,
        SKIPPED,
        FAILED
    }

    public static ItemResult ok(String itemKey) {
        return new ItemResult(itemKey, Status.OK, null);
    }

    public static ItemResult ok(String itemKey, String detail) {
        return new ItemResult(itemKey, Status.OK, detail);
    }

    public static ItemResult skipped(String itemKey, String reason) {
        return new ItemResult(itemKey, Status.SKIPPED, reason);
    }

    public static ItemResult failed(String itemKey, Throwable error) {
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ItemResult(itemKey, Status.FAILED, detail);
    }

    public static ItemResult failed(String itemKey, String detail) {
        return new ItemResult(itemKey, Status.FAILED, detail);
    }
}
