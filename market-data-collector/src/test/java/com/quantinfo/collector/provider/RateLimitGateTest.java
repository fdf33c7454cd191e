package com.quantinfo.collector.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for minimum-interval enforcement.
 */
class RateLimitGateTest {

    @Test
    void testAcquire_FirstCall_DoesNotWait() throws Exception {
        RateLimitGate gate = new RateLimitGate(Duration.ofSeconds(5));

        long start = System.nanoTime();
        gate.acquire();

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
    }

    @Test
    void testAcquire_ConsecutiveCalls_SpacedByInterval() throws Exception {
        // Arrange
        RateLimitGate gate = new RateLimitGate(Duration.ofMillis(100));
        int calls = 4;

        // Act
        long start = System.nanoTime();
        for (int i = 0; i < calls; i++) {
            gate.acquire();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertTrue(elapsedMs >= (calls - 1) * 100L - 5, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void testAcquire_InterruptedWhileWaiting_ThrowsInterruptedException() throws Exception {
        // Arrange
        RateLimitGate gate = new RateLimitGate(Duration.ofSeconds(30));
        gate.acquire();
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try {
                gate.acquire();
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                done.countDown();
            }
        });

        // Act
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();

        // Assert
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(interrupted.get());
    }

    @Test
    void testConstructor_NegativeInterval_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitGate(Duration.ofSeconds(-1)));
    }
}
