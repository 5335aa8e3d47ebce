package com.platform.healthmonitor.retry;

import com.platform.healthmonitor.model.EntityStatus;

/**
 * One deferred re-probe of a degraded container.
 *
 * @param previousStatus status tracked immediately before the degrading transition
 * @param attempt        1-based attempt number, drives the backoff delay
 */
public record RetryTask(
    String entityId,
    String group,
    EntityStatus previousStatus,
    int attempt
) {
    
    public RetryTask {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
    }
    
    public static RetryTask first(String entityId, String group, EntityStatus previousStatus) {
        return new RetryTask(entityId, group, previousStatus, 1);
    }
    
    public RetryTask nextAttempt() {
        return new RetryTask(entityId, group, previousStatus, attempt + 1);
    }
}
