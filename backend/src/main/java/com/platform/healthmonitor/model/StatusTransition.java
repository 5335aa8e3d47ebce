package com.platform.healthmonitor.model;

/**
 * Result of comparing a fresh probe against the previously tracked status.
 */
public record StatusTransition(
    String entityId,
    String group,
    EntityStatus previousStatus,
    EntityStatus currentStatus
) {
    
    public boolean changed() {
        return previousStatus != currentStatus;
    }
    
    /**
     * Changed into a status that must be confirmed by a deferred re-probe.
     */
    public boolean becameDegraded() {
        return changed() && !currentStatus.isHealthy();
    }
    
    /**
     * Changed back to healthy from a degraded status.
     */
    public boolean recovered() {
        return changed() && currentStatus.isHealthy() && previousStatus.isDegraded();
    }
    
    public String describe() {
        return String.format("%s -> %s", previousStatus.getWireValue(), currentStatus.getWireValue());
    }
}
