package com.platform.healthmonitor.error;

/**
 * Transport or protocol failure while talking to the probe source.
 * A listing failure aborts one pass; a probe failure abandons one container's check.
 */
public class ProbeSourceException extends HealthMonitorException {
    
    private final String entityId;
    
    public ProbeSourceException(ErrorCode errorCode, String entityId, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.entityId = entityId;
    }
    
    public static ProbeSourceException listFailed(String message, Throwable cause) {
        return new ProbeSourceException(ErrorCode.PROBE_LIST_FAILED, null, message, cause);
    }
    
    public static ProbeSourceException probeFailed(String entityId, String message, Throwable cause) {
        return new ProbeSourceException(ErrorCode.PROBE_FAILED, entityId, message, cause);
    }
    
    public static ProbeSourceException unavailable(String entityId, String message, Throwable cause) {
        return new ProbeSourceException(ErrorCode.PROBE_SOURCE_UNAVAILABLE, entityId, message, cause);
    }
    
    /**
     * Container the failed call was about, or null for listing failures.
     */
    public String getEntityId() {
        return entityId;
    }
}
