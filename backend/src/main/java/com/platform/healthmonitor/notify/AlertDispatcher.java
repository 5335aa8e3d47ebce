package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.model.Alert;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Boundary between the state machine and the alert channels.
 * 
 * Resolves recipients, fans the alert out to every enabled channel and contains
 * channel failures: nothing thrown by a notifier reaches the caller, and a failed
 * delivery never rolls back state already recorded.
 */
@Slf4j
@Component
public class AlertDispatcher {
    
    private final List<AlertNotifier> notifiers;
    private final RecipientRouter recipientRouter;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public AlertDispatcher(
            List<AlertNotifier> notifiers,
            RecipientRouter recipientRouter,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.notifiers = List.copyOf(notifiers);
        this.recipientRouter = recipientRouter;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        
        if (this.notifiers.isEmpty()) {
            log.warn("No alert channels enabled; escalations will only be logged");
        } else {
            log.info("Alert channels: {}", this.notifiers.stream().map(AlertNotifier::channel).toList());
        }
    }
    
    /**
     * Build and deliver an alert for one container.
     * 
     * @param previousStatus status before the transition, or null if unknown
     * @return number of channels that accepted the alert
     */
    public int dispatch(String entityId, String group, EntityStatus status, 
                        EntityStatus previousStatus, String details) {
        Alert alert = new Alert(
            entityId,
            group,
            status,
            previousStatus,
            details,
            recipientRouter.recipientsFor(entityId, group),
            clock.instant()
        );
        
        log.warn("[ALERT] {} [{}] {}: {}", alert.severity(), group, entityId, alert.statusChange());
        
        int delivered = 0;
        for (AlertNotifier notifier : notifiers) {
            try {
                notifier.notify(alert);
                delivered++;
                metricsRegistry.recordAlert(notifier.channel(), status.getWireValue(), true);
                log.info("✓ Alert sent via {} for [{}] {} to {}", 
                    notifier.channel(), group, entityId, String.join(", ", alert.recipients()));
            } catch (RuntimeException e) {
                metricsRegistry.recordAlert(notifier.channel(), status.getWireValue(), false);
                log.error("✗ Failed to send alert via {} for [{}] {}: {}", 
                    notifier.channel(), group, entityId, e.getMessage(), e);
            }
        }
        return delivered;
    }
}
