package com.quantinfo.collector.domain;

/**
 * Result of refreshing the price history of a single instrument.
 */
public enum RefreshOutcome {
    UPDATED(true),
    ALREADY_CURRENT(true),
    INACTIVE(true),
    NO_DATA(false),
    NOT_FOUND(false),
    FAILED(false);

    private final boolean success;

    RefreshOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
