package com.platform.healthmonitor.error;

/**
 * The container vanished while being probed.
 * Callers treat this as a NOT_FOUND observation rather than a failure.
 */
public class EntityNotFoundException extends HealthMonitorException {
    
    private final String entityId;
    
    public EntityNotFoundException(String entityId) {
        super(ErrorCode.ENTITY_NOT_FOUND, "Container not found: " + entityId);
        this.entityId = entityId;
    }
    
    public String getEntityId() {
        return entityId;
    }
}
