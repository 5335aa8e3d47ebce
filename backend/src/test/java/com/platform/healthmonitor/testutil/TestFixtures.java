package com.platform.healthmonitor.testutil;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.notify.AlertDispatcher;
import com.platform.healthmonitor.notify.AlertNotifier;
import com.platform.healthmonitor.notify.RecipientRouter;
import com.platform.healthmonitor.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class TestFixtures {
    
    public static final String OPS = "ops@example.com";
    
    private TestFixtures() {
    }
    
    /**
     * Properties with millisecond-scale retry timing.
     */
    public static HealthMonitorProperties fastProperties() {
        HealthMonitorProperties properties = new HealthMonitorProperties();
        properties.getAlert().setDefaultRecipients(List.of(OPS));
        properties.getRetry().setBaseDelay(Duration.ofMillis(50));
        properties.getRetry().setSleepSlice(Duration.ofMillis(10));
        properties.getProbe().setPassTimeout(Duration.ofSeconds(5));
        properties.getPool().setSize(8);
        return properties;
    }
    
    public static MetricsRegistry metrics() {
        return new MetricsRegistry(new SimpleMeterRegistry());
    }
    
    public static AlertDispatcher dispatcher(MetricsRegistry metrics, AlertNotifier... notifiers) {
        return new AlertDispatcher(
            List.of(notifiers),
            new RecipientRouter(Map.of(), List.of(OPS)),
            metrics,
            Clock.systemUTC()
        );
    }
}
