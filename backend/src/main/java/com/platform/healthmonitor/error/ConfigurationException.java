package com.platform.healthmonitor.error;

/**
 * Configuration that passes binding but cannot be used. Thrown during startup.
 */
public class ConfigurationException extends HealthMonitorException {
    
    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
