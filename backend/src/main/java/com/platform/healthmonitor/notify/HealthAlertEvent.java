package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.model.Alert;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire format of alerts published to Kafka.
 */
public record HealthAlertEvent(
    String eventId,
    String entityId,
    String group,
    String status,
    String previousStatus,
    String severity,
    String details,
    Instant timestamp
) {
    
    public static HealthAlertEvent from(Alert alert) {
        return new HealthAlertEvent(
            UUID.randomUUID().toString(),
            alert.entityId(),
            alert.group(),
            alert.status().getWireValue(),
            alert.previousStatus() != null ? alert.previousStatus().getWireValue() : null,
            alert.severity().name(),
            alert.details(),
            alert.timestamp()
        );
    }
}
