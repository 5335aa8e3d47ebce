package com.platform.healthmonitor.error;

/**
 * Base exception for all health monitor exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class HealthMonitorException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected HealthMonitorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected HealthMonitorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
