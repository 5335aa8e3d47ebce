package com.platform.healthmonitor.retry;

/**
 * How a retry task ended.
 */
public enum RetryOutcome {
    
    /**
     * Healthy again when re-probed; no alert.
     */
    RECOVERED,
    
    /**
     * Still degraded when re-probed; alert sent.
     */
    ESCALATED,
    
    /**
     * Gone when re-probed; record removed and NOT_FOUND alert sent unless a pass already reported it.
     */
    VANISHED,
    
    /**
     * No longer reports health information; dropped silently.
     */
    UNMONITORED,
    
    /**
     * Re-probe failed at the transport level; nothing learned.
     */
    INCONCLUSIVE,
    
    /**
     * Shutdown signalled during the backoff wait.
     */
    CANCELLED,
    
    /**
     * Unexpected error inside the task.
     */
    FAILED;
    
    public String tag() {
        return name().toLowerCase();
    }
}
