package com.platform.healthmonitor.retry;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay calculation with optional exponential backoff and jitter.
 *
 * Delay for attempt n: base when backoff is disabled or n == 1, otherwise
 * min(base * multiplier^(n-1), maxDelay); plus a uniform jitter in [0, jitter].
 */
@Slf4j
@Component
public class BackoffPolicy {
    
    private final Duration baseDelay;
    private final boolean backoffEnabled;
    private final double multiplier;
    private final Duration maxDelay;
    private final Duration jitter;
    private final int maxAttempts;
    private final DoubleSupplier random;
    
    @Autowired
    public BackoffPolicy(HealthMonitorProperties properties) {
        this(properties.getRetry(), () -> ThreadLocalRandom.current().nextDouble());
    }
    
    /**
     * @param random source of uniform values in [0, 1)
     */
    public BackoffPolicy(HealthMonitorProperties.Retry retry, DoubleSupplier random) {
        this.baseDelay = retry.getBaseDelay();
        this.backoffEnabled = retry.isBackoffEnabled();
        this.multiplier = retry.getMultiplier();
        this.maxDelay = retry.getMaxDelay();
        this.jitter = retry.getJitter();
        this.maxAttempts = retry.getMaxAttempts();
        this.random = random;
        
        log.info("Backoff policy: base={}, backoff={}, multiplier={}, max={}, jitter={}, maxAttempts={}",
            baseDelay, backoffEnabled, multiplier, maxDelay, jitter, maxAttempts);
    }
    
    /**
     * Delay for an attempt, without jitter.
     */
    public Duration baseDelayFor(int attempt) {
        if (!backoffEnabled || attempt <= 1) {
            return baseDelay;
        }
        
        double exponentialMs = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long cappedMs = (long) Math.min(exponentialMs, (double) maxDelay.toMillis());
        return Duration.ofMillis(cappedMs);
    }
    
    /**
     * Delay for an attempt, jitter included.
     */
    public Duration delayFor(int attempt) {
        Duration delay = baseDelayFor(attempt);
        if (jitter.isZero() || jitter.isNegative()) {
            return delay;
        }
        
        long jitterMs = Math.round(jitter.toMillis() * random.getAsDouble());
        return delay.plusMillis(jitterMs);
    }
    
    /**
     * Whether a task that escalated on this attempt should be re-armed.
     */
    public boolean shouldRearmAfterEscalation(int attempt) {
        return backoffEnabled && attempt < maxAttempts;
    }
    
    /**
     * Whether an inconclusive attempt may be repeated.
     */
    public boolean hasAttemptsLeft(int attempt) {
        return attempt < maxAttempts;
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
}
