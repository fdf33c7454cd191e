package com.quantinfo.collector.infrastructure;

import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.service.IngestionMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Background task that repeatedly sleeps until its next run time and then executes.
 * Each task runs in its own thread. Sleeps are taken in bounded slices and the clock is
 * re-read after every wake-up, so an early wake-up simply sleeps again.
 * An unhandled error backs off for the configured duration instead of ending the task.
 */
@Slf4j
public abstract class PeriodicTask implements Runnable {

    static final long MAX_SLEEP_SLICE_MS = 60_000;

    protected final IngestionMetricsService metricsService;
    protected final Clock clock;
    private final Duration errorBackoff;
    private final String name;

    private volatile boolean running = true;

    protected PeriodicTask(String name, IngestionMetricsService metricsService, Clock clock, Duration errorBackoff) {
        this.name = name;
        this.metricsService = metricsService;
        this.clock = clock;
        this.errorBackoff = errorBackoff;
    }

    /**
     * Next time the task should run, given the current time.
     */
    protected abstract ZonedDateTime nextRun(ZonedDateTime now);

    /**
     * Execute one run of the task.
     */
    protected abstract void runOnce() throws InterruptedException;

    @Override
    public void run() {
        MDC.put("task", name);
        log.info("{} started", name);
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    ZonedDateTime next = nextRun(now());
                    log.debug("{} next run at {}", name, next);
                    if (!sleepUntil(next)) {
                        break;
                    }
                    runOnce();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("{} failed: {}; backing off for {}", name, e.getMessage(), errorBackoff, e);
                    metricsService.recordTaskError(name);
                    try {
                        sleepUntil(now().plus(errorBackoff));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("{} interrupted during error backoff", name);
                        break;
                    }
                }
            }
        } finally {
            log.info("{} stopped", name);
            MDC.remove("task");
        }
    }

    /**
     * Sleep until the target time.
     *
     * @return true once the target is reached, false if the task was stopped first
     */
    boolean sleepUntil(ZonedDateTime target) throws InterruptedException {
        while (running) {
            long remaining = Duration.between(now(), target).toMillis();
            if (remaining <= 0) {
                return true;
            }
            Thread.sleep(Math.min(remaining, MAX_SLEEP_SLICE_MS));
        }
        return false;
    }

    protected ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    /**
     * Log the result of a batch run as one structured line.
     */
    protected void logResult(RefreshTally tally) {
        log.info("task={} total={} success={} failed={} durationMs={} failures={}", name, tally.getTotal(),
                tally.getSuccess(), tally.getFailed(), tally.getElapsedMillis(), tally.getFailures());
    }

    /**
     * Today at the given time, or tomorrow if that moment is not in the future.
     */
    public static ZonedDateTime nextDailyRun(ZonedDateTime now, LocalTime at) {
        ZonedDateTime candidate = now.with(at).withNano(0);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    void reset() {
        running = true;
    }

    public void stop() {
        log.info("Stopping {}", name);
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }
}
