package com.platform.healthmonitor.model;

/**
 * A listed container: stable identifier plus its project/group label.
 */
public record EntityDescriptor(String entityId, String group) {
}
