package com.quantinfo.collector.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable success/failure counts of a batch refresh.
 * Tallies combine with {@link #merge(RefreshTally)}, which is associative and commutative
 * so per-instrument results can be folded in any completion order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RefreshTally {

    private static final RefreshTally EMPTY = new RefreshTally(0, 0, 0, Collections.emptyMap(), Duration.ZERO);

    private final int total;
    private final int success;
    private final int failed;

    // failed symbols keyed to the outcome that failed them
    private final Map<String, RefreshOutcome> failures;

    @EqualsAndHashCode.Exclude
    private final Duration elapsed;

    private RefreshTally(int total, int success, int failed, Map<String, RefreshOutcome> failures,
            Duration elapsed) {
        this.total = total;
        this.success = success;
        this.failed = failed;
        this.failures = failures;
        this.elapsed = elapsed;
    }

    public static RefreshTally empty() {
        return EMPTY;
    }

    /**
     * Tally of a single instrument refresh.
     */
    public static RefreshTally of(String symbol, RefreshOutcome outcome) {
        if (outcome.isSuccess()) {
            return new RefreshTally(1, 1, 0, Collections.emptyMap(), Duration.ZERO);
        }
        return new RefreshTally(1, 0, 1, Collections.singletonMap(symbol, outcome), Duration.ZERO);
    }

    public RefreshTally merge(RefreshTally other) {
        if (other.total == 0) {
            return this;
        }
        if (total == 0) {
            return other;
        }
        Map<String, RefreshOutcome> merged = new LinkedHashMap<>(failures);
        merged.putAll(other.failures);
        return new RefreshTally(total + other.total, success + other.success, failed + other.failed,
                Collections.unmodifiableMap(merged), elapsed.compareTo(other.elapsed) >= 0 ? elapsed : other.elapsed);
    }

    public RefreshTally withElapsed(Duration duration) {
        return new RefreshTally(total, success, failed, failures, duration);
    }

    public long getElapsedMillis() {
        return elapsed.toMillis();
    }
}
