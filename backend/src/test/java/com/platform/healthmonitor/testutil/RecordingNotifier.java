package com.platform.healthmonitor.testutil;

import com.platform.healthmonitor.error.NotificationException;
import com.platform.healthmonitor.model.Alert;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.notify.AlertNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Alert channel that keeps every alert it receives, optionally failing after recording.
 */
public class RecordingNotifier implements AlertNotifier {
    
    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    
    @Override
    public String channel() {
        return "recording";
    }
    
    @Override
    public void notify(Alert alert) {
        alerts.add(alert);
        if (failing) {
            throw new NotificationException(channel(), "SMTP server refused connection", null);
        }
    }
    
    public void setFailing(boolean failing) {
        this.failing = failing;
    }
    
    public List<Alert> alerts() {
        return List.copyOf(alerts);
    }
    
    public List<Alert> alertsFor(String entityId) {
        return alerts.stream().filter(a -> a.entityId().equals(entityId)).toList();
    }
    
    public long countWithStatus(EntityStatus status) {
        return alerts.stream().filter(a -> a.status() == status).count();
    }
}
