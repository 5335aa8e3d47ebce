package com.platform.healthmonitor.lifecycle;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Marks the monitor ready once the context has started and logs the effective settings.
 */
@Slf4j
@Component
public class ApplicationStartupListener {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final HealthMonitorProperties properties;
    
    public ApplicationStartupListener(ApplicationLifecycleManager lifecycleManager, 
                                      HealthMonitorProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.properties = properties;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        HealthMonitorProperties.Retry retry = properties.getRetry();
        log.info("Starting Multi-Project Docker Health Monitor");
        log.info("Server: {}", properties.getAlert().getServerName());
        log.info("Check interval: {}s", properties.getProbe().getIntervalMs() / 1000);
        log.info("Retry delay: {}s (backoff {}, max attempts {})", 
            retry.getBaseDelay().toSeconds(), retry.isBackoffEnabled() ? "enabled" : "disabled", 
            retry.getMaxAttempts());
        log.info("Default recipients: {}", String.join(", ", properties.getAlert().getDefaultRecipients()));
        if (!properties.getAlert().getRouting().isEmpty()) {
            log.info("Project-specific routing configured for: {}", 
                String.join(", ", properties.getAlert().getRouting().keySet()));
        }
        
        lifecycleManager.markReady();
    }
}
