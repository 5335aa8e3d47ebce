package com.platform.healthmonitor.model;

import java.time.Instant;
import java.util.List;

/**
 * A rendered-ready escalation for one container.
 * {@code previousStatus} is null when the pre-transition status is not known.
 */
public record Alert(
    String entityId,
    String group,
    EntityStatus status,
    EntityStatus previousStatus,
    String details,
    List<String> recipients,
    Instant timestamp
) {
    
    public enum Severity {
        CRITICAL,
        ERROR,
        WARNING,
        INFO
    }
    
    public Alert {
        recipients = List.copyOf(recipients);
    }
    
    public Severity severity() {
        return switch (status) {
            case UNHEALTHY -> Severity.CRITICAL;
            case NOT_FOUND -> Severity.ERROR;
            case STARTING -> Severity.WARNING;
            default -> Severity.INFO;
        };
    }
    
    public String statusChange() {
        if (previousStatus == null) {
            return status.getWireValue();
        }
        return previousStatus.getWireValue() + " → " + status.getWireValue();
    }
}
