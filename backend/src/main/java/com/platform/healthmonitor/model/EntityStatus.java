package com.platform.healthmonitor.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Coarse health status of a monitored container.
 * 
 * Transitions are evaluated by set membership, never by ordinal comparison.
 */
public enum EntityStatus {
    
    /**
     * Never probed, or probed without health information.
     */
    UNKNOWN("unknown"),
    
    /**
     * Healthcheck has not produced a verdict yet.
     */
    STARTING("starting"),
    
    HEALTHY("healthy"),
    
    UNHEALTHY("unhealthy"),
    
    /**
     * Vanished from the container listing. Terminal for the identifier.
     */
    NOT_FOUND("not_found");
    
    private final String wireValue;
    
    EntityStatus(String wireValue) {
        this.wireValue = wireValue;
    }
    
    public String getWireValue() {
        return wireValue;
    }
    
    /**
     * Statuses that warrant a deferred re-probe before alerting.
     */
    public boolean isDegraded() {
        return this == STARTING || this == UNHEALTHY;
    }
    
    public boolean isHealthy() {
        return this == HEALTHY;
    }
    
    /**
     * Parse a Docker health status string ({@code State.Health.Status}).
     */
    public static Optional<EntityStatus> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(status -> status.wireValue.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
