package com.platform.healthmonitor.error;

/**
 * Standardized error codes for the health monitor.
 * 
 * Format: HM-{CATEGORY}{NUMBER}
 * Categories:
 * - 2xx: Request errors (malformed input)
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External collaborator errors (Docker, notification channels)
 * - 9xx: Internal errors (unexpected, configuration)
 */
public enum ErrorCode {
    
    // ==================== Request Errors (2xx) ====================
    
    INVALID_REQUEST("HM-200", "Invalid request", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    ENTITY_NOT_FOUND("HM-300", "Container not found", ErrorCategory.RECOVERABLE),
    RESOURCE_NOT_FOUND("HM-301", "Resource not found", ErrorCategory.RECOVERABLE),
    SHUTDOWN_IN_PROGRESS("HM-310", "Monitor is shutting down", ErrorCategory.RECOVERABLE),
    
    // ==================== Collaborator Errors (4xx) ====================
    
    PROBE_LIST_FAILED("HM-410", "Failed to list containers", ErrorCategory.RECOVERABLE),
    PROBE_FAILED("HM-411", "Failed to probe container health", ErrorCategory.RECOVERABLE),
    PROBE_SOURCE_UNAVAILABLE("HM-412", "Docker engine unavailable", ErrorCategory.RECOVERABLE),
    NOTIFICATION_FAILED("HM-420", "Failed to deliver alert", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("HM-900", "Internal error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("HM-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        RECOVERABLE,
        FATAL
    }
}
