package com.platform.healthmonitor.model;

import java.time.Instant;

/**
 * Last observed state of one tracked container.
 * Instances are immutable; the state store replaces them on every update.
 */
public record EntityRecord(
    String entityId,
    String group,
    EntityStatus status,
    Instant lastChecked
) {
}
