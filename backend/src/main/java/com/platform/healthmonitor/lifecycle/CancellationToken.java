package com.platform.healthmonitor.lifecycle;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide cancellation signal observed by every suspension point.
 *
 * Sleeps wait on a latch, so a cancellation wakes sleepers immediately. The wait is
 * still split into slices no longer than {@code sleepSlice}, so thread interrupts and
 * clock adjustments are observed with the same bounded latency.
 */
@Slf4j
@Component
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Duration sleepSlice;

    @Autowired
    public CancellationToken(HealthMonitorProperties properties) {
        this(properties.getRetry().getSleepSlice());
    }

    public CancellationToken(Duration sleepSlice) {
        if (sleepSlice.isZero() || sleepSlice.isNegative()) {
            throw new IllegalArgumentException("sleepSlice must be positive: " + sleepSlice);
        }
        if (sleepSlice.compareTo(HealthMonitorProperties.Retry.MAX_SLEEP_SLICE) > 0) {
            throw new IllegalArgumentException("sleepSlice must not exceed "
                + HealthMonitorProperties.Retry.MAX_SLEEP_SLICE + ": " + sleepSlice);
        }
        this.sleepSlice = sleepSlice;
    }

    /**
     * Signal cancellation. Idempotent.
     */
    public void cancel() {
        if (cancelled.getCount() > 0) {
            log.info("Cancellation requested");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for the given duration unless cancelled first.
     * An interrupt of the sleeping thread counts as cancellation of this sleep only;
     * the interrupt flag is restored.
     *
     * @return true if the full duration elapsed, false if the sleep was cut short
     */
    public boolean sleep(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();

        while (!isCancelled()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return true;
            }

            long slice = Math.min(remaining, sleepSlice.toNanos());
            try {
                if (cancelled.await(slice, TimeUnit.NANOSECONDS)) {
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }
}
