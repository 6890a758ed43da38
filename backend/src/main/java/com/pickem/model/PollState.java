package com.pickem.model;

/**
 * Lifecycle phases of the poll for one (channel, game) pair. Phases only move forward.
 */
public enum PollState {
    PENDING,
    CREATED,
    OPEN,
    CLOSED,
    RESULTS_POSTED;

    public static PollState of(Poll poll) {
        if (poll == null) {
            return PENDING;
        }
        if (poll.isResultPosted()) {
            return RESULTS_POSTED;
        }
        if (poll.isClosed()) {
            return CLOSED;
        }
        if (poll.getMessageId() != null) {
            return OPEN;
        }
        return CREATED;
    }
}
