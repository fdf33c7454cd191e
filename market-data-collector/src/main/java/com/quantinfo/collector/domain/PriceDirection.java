package com.quantinfo.collector.domain;

/**
 * Direction of the intraday move from open to close.
 */
public enum PriceDirection {
    UP,
    DOWN,
    FLAT;

    public static PriceDirection of(double open, double close) {
        if (close > open) {
            return UP;
        }
        if (close < open) {
            return DOWN;
        }
        return FLAT;
    }
}
