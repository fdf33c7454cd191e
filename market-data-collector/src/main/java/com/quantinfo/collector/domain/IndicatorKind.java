package com.quantinfo.collector.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of technical indicator series maintained per instrument.
 */
public enum IndicatorKind {
    MA,
    EMA,
    RSI,
    MACD;

    /**
     * Kinds recomputed when a request names none.
     */
    public static Set<IndicatorKind> defaults() {
        return EnumSet.allOf(IndicatorKind.class);
    }
}
