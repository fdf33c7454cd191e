package com.quantinfo.collector.provider;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum interval between consecutive provider calls.
 * Callers are admitted one at a time in arrival order; the wait is interruptible.
 */
@Slf4j
public class RateLimitGate {

    private final long minIntervalMillis;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private long lastCallMillis = Long.MIN_VALUE;

    public RateLimitGate(Duration minInterval, Clock clock) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("Minimum interval must not be negative: " + minInterval);
        }
        this.minIntervalMillis = minInterval.toMillis();
        this.clock = clock;
    }

    public RateLimitGate(Duration minInterval) {
        this(minInterval, Clock.systemUTC());
    }

    /**
     * Block until at least the minimum interval has passed since the previous admitted call,
     * then record this call.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (lastCallMillis != Long.MIN_VALUE) {
                long wait = lastCallMillis + minIntervalMillis - clock.millis();
                while (wait > 0) {
                    log.debug("Rate limit: waiting {} ms", wait);
                    Thread.sleep(wait);
                    wait = lastCallMillis + minIntervalMillis - clock.millis();
                }
            }
            lastCallMillis = clock.millis();
        } finally {
            lock.unlock();
        }
    }
}
