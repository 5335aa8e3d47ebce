package com.platform.healthmonitor.lifecycle;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orderly shutdown of the monitor.
 * 
 * Order:
 * 1. Stop accepting passes and retry arms
 * 2. Cancel the token, waking every sleeping retry
 * 3. Drain the worker pool, bounded by the shutdown timeout
 * 4. Mark stopped
 * 
 * Retries cut short in step 2 end without probing or alerting.
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final CancellationToken cancellationToken;
    private final ThreadPoolTaskExecutor probeExecutor;
    private final RetryRegistry retryRegistry;
    private final MetricsRegistry metricsRegistry;
    private final Duration shutdownTimeout;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            ApplicationLifecycleManager lifecycleManager,
            CancellationToken cancellationToken,
            @Qualifier("probeExecutor") ThreadPoolTaskExecutor probeExecutor,
            RetryRegistry retryRegistry,
            MetricsRegistry metricsRegistry,
            HealthMonitorProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.cancellationToken = cancellationToken;
        this.probeExecutor = probeExecutor;
        this.retryRegistry = retryRegistry;
        this.metricsRegistry = metricsRegistry;
        this.shutdownTimeout = properties.getShutdown().getTimeout();
    }
    
    @PostConstruct
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::emergencyShutdown, "monitor-shutdown-hook"));
        log.info("Graceful shutdown manager initialized (timeout={}s)", shutdownTimeout.toSeconds());
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    @PreDestroy
    public void onPreDestroy() {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * Run the shutdown sequence once. Later calls return immediately.
     * 
     * @return true if the worker pool terminated within the timeout
     */
    public synchronized boolean performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return probeExecutor.getThreadPoolExecutor().isTerminated();
        }
        
        long start = System.nanoTime();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        
        log.info("[1/4] Refusing new passes and retries...");
        lifecycleManager.startDraining();
        
        int inFlight = retryRegistry.size();
        log.info("[2/4] Cancelling {} pending retries...", inFlight);
        cancellationToken.cancel();
        
        log.info("[3/4] Draining worker pool...");
        boolean terminated = drainWorkerPool();
        
        log.info("[4/4] Stopping...");
        lifecycleManager.markStopped();
        metricsRegistry.incrementCounter("healthmonitor.shutdown", 
            "status", terminated ? "complete" : "timeout");
        
        log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========", 
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return terminated;
    }
    
    private void emergencyShutdown() {
        if (!shuttingDown.get()) {
            log.warn("Emergency shutdown hook triggered");
            performGracefulShutdown();
        }
    }
    
    private boolean drainWorkerPool() {
        ThreadPoolExecutor executor = probeExecutor.getThreadPoolExecutor();
        executor.shutdown();
        try {
            if (executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("All worker tasks completed");
                return true;
            }
            log.warn("Timeout waiting for worker tasks, forcing shutdown ({} still active)", 
                executor.getActiveCount());
            executor.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining worker pool");
            executor.shutdownNow();
        }
        return false;
    }
}
