package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.error.NotificationException;
import com.platform.healthmonitor.model.Alert;

/**
 * Delivery channel for escalations.
 */
public interface AlertNotifier {
    
    /**
     * Channel name, used in logs and metric tags.
     */
    String channel();
    
    /**
     * Deliver one alert synchronously.
     * 
     * @throws NotificationException if delivery failed
     */
    void notify(Alert alert);
}
