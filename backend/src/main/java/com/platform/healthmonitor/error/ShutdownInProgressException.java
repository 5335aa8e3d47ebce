package com.platform.healthmonitor.error;

/**
 * Rejects new work once the shutdown sequence has started.
 */
public class ShutdownInProgressException extends HealthMonitorException {
    
    public ShutdownInProgressException(String message) {
        super(ErrorCode.SHUTDOWN_IN_PROGRESS, message);
    }
}
