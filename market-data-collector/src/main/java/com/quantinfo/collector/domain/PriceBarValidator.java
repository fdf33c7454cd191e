package com.quantinfo.collector.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Sanity checks applied to every bar before it is stored.
 * A bar is accepted when all prices are positive, volume is non-negative and
 * both open and close lie within [low, high].
 */
@Slf4j
public final class PriceBarValidator {

    private PriceBarValidator() {
    }

    public static boolean isValid(BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, Long volume) {
        if (open == null || high == null || low == null || close == null || volume == null) {
            return false;
        }
        if (open.signum() <= 0 || high.signum() <= 0 || low.signum() <= 0 || close.signum() <= 0) {
            return false;
        }
        if (volume < 0) {
            return false;
        }
        return low.compareTo(open) <= 0 && open.compareTo(high) <= 0
                && low.compareTo(close) <= 0 && close.compareTo(high) <= 0;
    }

    public static boolean isValid(PriceBar bar) {
        boolean valid = isValid(bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        if (!valid) {
            log.warn("Rejecting bar {} o={} h={} l={} c={} v={}", bar.getTradeDate(), bar.getOpen(),
                    bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        }
        return valid;
    }
}
