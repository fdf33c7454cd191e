package com.quantinfo.collector.service;

/**
 * Thrown when an operation names an instrument id that is not stored.
 */
public class InstrumentNotFoundException extends RuntimeException {

    private final Long instrumentId;

    public InstrumentNotFoundException(Long instrumentId) {
        super("Instrument not found: " + instrumentId);
        this.instrumentId = instrumentId;
    }

    public Long getInstrumentId() {
        return instrumentId;
    }
}
