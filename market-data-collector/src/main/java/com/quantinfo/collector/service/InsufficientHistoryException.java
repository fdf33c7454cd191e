package com.quantinfo.collector.service;

/**
 * Thrown when an instrument has too few stored bars to compute indicators.
 */
public class InsufficientHistoryException extends RuntimeException {

    private final String symbol;
    private final long available;
    private final int required;

    public InsufficientHistoryException(String symbol, long available, int required) {
        super(String.format("Insufficient history for %s: %d bars, %d required", symbol, available, required));
        this.symbol = symbol;
        this.available = available;
        this.required = required;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
