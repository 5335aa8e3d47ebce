package com.platform.healthmonitor.error;

/**
 * An alert channel failed to deliver. Logged at the dispatch boundary, never retried.
 */
public class NotificationException extends HealthMonitorException {
    
    private final String channel;
    
    public NotificationException(String channel, String message, Throwable cause) {
        super(ErrorCode.NOTIFICATION_FAILED, message, cause);
        this.channel = channel;
    }
    
    public String getChannel() {
        return channel;
    }
}
