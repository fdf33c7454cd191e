package com.quantinfo.collector.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ranking criteria. {@link #COMPREHENSIVE} is the weighted combination of the other five.
 */
public enum RankingDimension {
    ACTIVITY("activity"),
    VOLATILITY("volatility"),
    PERFORMANCE("performance"),
    MARKET_CAP("market-cap"),
    PRICE("price"),
    COMPREHENSIVE("comprehensive");

    private final String path;

    RankingDimension(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    /**
     * Resolve a dimension from its URL path segment (e.g. "market-cap").
     */
    public static Optional<RankingDimension> fromPath(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase().replace('_', '-');
        return Arrays.stream(values())
                .filter(d -> d.path.equals(normalized))
                .findFirst();
    }
}
