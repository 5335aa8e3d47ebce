package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses alert recipients per container.
 * 
 * Routing entries are checked in configuration order; the first pattern contained in
 * the container name or the project name wins. Otherwise the default list applies.
 */
@Slf4j
@Component
public class RecipientRouter {
    
    private final Map<String, List<String>> routing;
    private final List<String> defaultRecipients;
    
    @Autowired
    public RecipientRouter(HealthMonitorProperties properties) {
        this(properties.getAlert().getRouting(), properties.getAlert().getDefaultRecipients());
    }
    
    public RecipientRouter(Map<String, List<String>> routing, List<String> defaultRecipients) {
        this.routing = new LinkedHashMap<>();
        routing.forEach((pattern, recipients) -> {
            List<String> cleaned = clean(recipients);
            if (pattern != null && !pattern.isBlank() && !cleaned.isEmpty()) {
                this.routing.put(pattern.trim(), cleaned);
            }
        });
        this.defaultRecipients = clean(defaultRecipients);
        
        if (this.defaultRecipients.isEmpty()) {
            throw new ConfigurationException("healthmonitor.alert.default-recipients must be configured");
        }
        if (!this.routing.isEmpty()) {
            log.info("Project-specific routing configured for: {}", String.join(", ", this.routing.keySet()));
        }
    }
    
    public List<String> recipientsFor(String entityId, String group) {
        for (Map.Entry<String, List<String>> entry : routing.entrySet()) {
            String pattern = entry.getKey();
            if (entityId.contains(pattern) || (group != null && group.contains(pattern))) {
                log.debug("Using project-specific routing for {}: {}", entityId, entry.getValue());
                return entry.getValue();
            }
        }
        return defaultRecipients;
    }
    
    private static List<String> clean(List<String> recipients) {
        if (recipients == null) {
            return List.of();
        }
        return recipients.stream()
            .filter(r -> r != null && !r.isBlank())
            .map(String::trim)
            .toList();
    }
}
