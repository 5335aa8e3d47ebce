package com.platform.healthmonitor.observability;

import org.slf4j.MDC;

/**
 * MDC helpers for correlating log lines of one pass and one container.
 */
public final class LoggingContext {
    
    public static final String PASS_ID = "passId";
    public static final String ENTITY_ID = "entityId";
    public static final String GROUP = "group";
    
    private LoggingContext() {
    }
    
    public static void setPassContext(String passId) {
        MDC.put(PASS_ID, passId);
    }
    
    public static void clearPassContext() {
        MDC.remove(PASS_ID);
    }
    
    /**
     * Set container information in MDC for logging.
     */
    public static void setEntityContext(String entityId, String group) {
        MDC.put(ENTITY_ID, entityId);
        if (group != null) {
            MDC.put(GROUP, group);
        }
    }
    
    public static void clearEntityContext() {
        MDC.remove(ENTITY_ID);
        MDC.remove(GROUP);
    }
}
