package com.platform.healthmonitor.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for all monitor metrics.
 * Provides methods for recording passes, probes, transitions, retries and alerts.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Register a gauge backed by a live value supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .description(description)
            .register(meterRegistry);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String operation, long latencyMs) {
        Timer timer = timers.computeIfAbsent(operation, k -> 
            Timer.builder("healthmonitor.operation.latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Record a completed or aborted probe pass.
     */
    public void recordPass(boolean aborted, long durationMs) {
        incrementCounter("healthmonitor.pass", "result", aborted ? "aborted" : "completed");
        recordLatency("pass", durationMs);
    }
    
    /**
     * Record the outcome of one container probe.
     */
    public void recordProbe(String outcome) {
        incrementCounter("healthmonitor.probe", "outcome", outcome);
    }
    
    /**
     * Record a status transition.
     */
    public void recordTransition(Object fromStatus, Object toStatus) {
        String from = fromStatus != null ? fromStatus.toString() : "null";
        String to = toStatus != null ? toStatus.toString() : "null";
        
        incrementCounter("healthmonitor.transition", "from", from, "to", to);
        log.debug("Recorded transition {} -> {}", from, to);
    }
    
    public void recordRetryArmed(int attempt) {
        incrementCounter("healthmonitor.retry.armed", "attempt", String.valueOf(attempt));
    }
    
    public void recordRetryDeduplicated() {
        incrementCounter("healthmonitor.retry.deduplicated");
    }
    
    public void recordRetryOutcome(String outcome) {
        incrementCounter("healthmonitor.retry.outcome", "outcome", outcome);
    }
    
    /**
     * Record an alert delivery attempt on one channel.
     */
    public void recordAlert(String channel, String status, boolean success) {
        incrementCounter("healthmonitor.alert", 
            "channel", channel, "status", status, "success", String.valueOf(success));
    }
    
    /**
     * Record an unexpected error caught at a containment boundary.
     */
    public void recordUnexpectedError(String boundary) {
        incrementCounter("healthmonitor.error.unexpected", "boundary", boundary);
    }
}
