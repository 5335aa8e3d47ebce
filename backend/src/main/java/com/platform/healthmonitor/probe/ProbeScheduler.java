package com.platform.healthmonitor.probe;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.error.EntityNotFoundException;
import com.platform.healthmonitor.error.ProbeSourceException;
import com.platform.healthmonitor.error.ShutdownInProgressException;
import com.platform.healthmonitor.lifecycle.CancellationToken;
import com.platform.healthmonitor.model.EntityDescriptor;
import com.platform.healthmonitor.model.EntityRecord;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.model.StatusTransition;
import com.platform.healthmonitor.notify.AlertDispatcher;
import com.platform.healthmonitor.observability.LoggingContext;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.retry.RetryScheduler;
import com.platform.healthmonitor.state.EntityStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Periodic probe pass over all running containers.
 * 
 * Each pass lists the containers, probes them concurrently on the worker pool,
 * records status changes and arms a deferred retry for every transition into a
 * degraded status. Tracked containers missing from the listing are alerted as
 * NOT_FOUND right away and forgotten.
 */
@Slf4j
@Service
public class ProbeScheduler {
    
    static final String DISAPPEARED_DETAILS = "Container is no longer running or has been removed.";
    
    private final ProbeSource probeSource;
    private final EntityStateStore stateStore;
    private final RetryScheduler retryScheduler;
    private final AlertDispatcher alertDispatcher;
    private final CancellationToken cancellationToken;
    private final AsyncTaskExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final HealthMonitorProperties properties;
    
    private final ReentrantLock passLock = new ReentrantLock();
    private volatile PassSummary lastSummary;
    
    public ProbeScheduler(
            ProbeSource probeSource,
            EntityStateStore stateStore,
            RetryScheduler retryScheduler,
            AlertDispatcher alertDispatcher,
            CancellationToken cancellationToken,
            @Qualifier("probeExecutor") AsyncTaskExecutor executor,
            MetricsRegistry metricsRegistry,
            Clock clock,
            HealthMonitorProperties properties) {
        this.probeSource = probeSource;
        this.stateStore = stateStore;
        this.retryScheduler = retryScheduler;
        this.alertDispatcher = alertDispatcher;
        this.cancellationToken = cancellationToken;
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.properties = properties;
        
        metricsRegistry.registerGauge("healthmonitor.entities.tracked", 
            "Containers with a recorded health status", stateStore::size);
    }
    
    @Scheduled(
        fixedRateString = "${healthmonitor.probe.interval-ms:30000}",
        initialDelayString = "${healthmonitor.probe.initial-delay-ms:0}")
    public void scheduledPass() {
        if (!properties.getProbe().isEnabled() || cancellationToken.isCancelled()) {
            return;
        }
        
        try {
            runOnce();
        } catch (ShutdownInProgressException e) {
            log.debug("Skipping pass: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in probe pass: {}", e.getMessage(), e);
            metricsRegistry.recordUnexpectedError("pass");
        }
    }
    
    /**
     * Run one pass and wait for its probe tasks, bounded by the pass timeout.
     * Passes are serialized; a caller arriving during a pass waits for it to end.
     * 
     * @throws ShutdownInProgressException if shutdown has begun
     */
    public PassSummary runOnce() {
        if (cancellationToken.isCancelled()) {
            throw new ShutdownInProgressException("Probe passes are stopped");
        }
        
        passLock.lock();
        String passId = UUID.randomUUID().toString().substring(0, 8);
        LoggingContext.setPassContext(passId);
        try {
            PassSummary summary = doRun(passId);
            lastSummary = summary;
            metricsRegistry.recordPass(summary.aborted(), summary.durationMs());
            if (summary.aborted()) {
                log.warn("Probe {}", summary.describe());
            } else {
                log.info("Probe {}", summary.describe());
            }
            return summary;
        } finally {
            LoggingContext.clearPassContext();
            passLock.unlock();
        }
    }
    
    public Optional<PassSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }
    
    private PassSummary doRun(String passId) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        
        List<EntityDescriptor> listed;
        try {
            listed = probeSource.listEntities();
        } catch (ProbeSourceException e) {
            log.error("Error listing containers, pass aborted: {}", e.getMessage());
            return PassSummary.aborted(passId, startedAt, elapsedMs(start));
        }
        
        Set<String> previouslyTracked = stateStore.snapshotIds();
        log.debug("Checking {} running containers ({} tracked)", listed.size(), previouslyTracked.size());
        
        List<Future<CheckResult>> futures = new ArrayList<>(listed.size());
        Map<CheckResult, Integer> counts = new EnumMap<>(CheckResult.class);
        for (EntityDescriptor descriptor : listed) {
            try {
                futures.add(executor.submit(() -> check(descriptor)));
            } catch (TaskRejectedException e) {
                log.warn("Probe of {} rejected by worker pool: {}", descriptor.entityId(), e.getMessage());
                counts.merge(CheckResult.FAILED, 1, Integer::sum);
            }
        }
        
        int disappeared = detectDisappeared(previouslyTracked, listed);
        int pending = awaitChecks(futures, counts);
        
        int armed = counts.getOrDefault(CheckResult.ARMED, 0);
        int transitions = counts.getOrDefault(CheckResult.CHANGED, 0) + armed;
        int probed = counts.getOrDefault(CheckResult.UNCHANGED, 0) + transitions;
        
        return new PassSummary(
            passId,
            startedAt,
            elapsedMs(start),
            listed.size(),
            probed,
            counts.getOrDefault(CheckResult.SKIPPED, 0),
            counts.getOrDefault(CheckResult.FAILED, 0),
            transitions,
            armed,
            disappeared,
            pending,
            false
        );
    }
    
    CheckResult check(EntityDescriptor descriptor) {
        String entityId = descriptor.entityId();
        String group = descriptor.group();
        LoggingContext.setEntityContext(entityId, group);
        try {
            Optional<EntityStatus> observed;
            try {
                observed = probeSource.probe(entityId);
            } catch (EntityNotFoundException e) {
                log.debug("[{}] {} vanished during probe", group, entityId);
                metricsRegistry.recordProbe("not_found");
                return CheckResult.SKIPPED;
            } catch (ProbeSourceException e) {
                log.error("Error checking [{}] {}: {}", group, entityId, e.getMessage());
                metricsRegistry.recordProbe("failed");
                return CheckResult.FAILED;
            }
            
            if (observed.isEmpty()) {
                metricsRegistry.recordProbe("no_health");
                return CheckResult.SKIPPED;
            }
            metricsRegistry.recordProbe("ok");
            
            EntityStatus previous = stateStore.statusOf(entityId);
            EntityStatus current = observed.get();
            stateStore.upsert(entityId, current, group, clock.instant());
            
            StatusTransition transition = new StatusTransition(entityId, group, previous, current);
            if (!transition.changed()) {
                return CheckResult.UNCHANGED;
            }
            
            log.info("[{}] {}: {}", group, entityId, transition.describe());
            metricsRegistry.recordTransition(previous, current);
            
            if (transition.becameDegraded()) {
                return retryScheduler.arm(entityId, group, previous) ? CheckResult.ARMED : CheckResult.CHANGED;
            }
            if (transition.recovered() && properties.getAlert().isNotifyOnRecovery()) {
                alertDispatcher.dispatch(entityId, group, current, previous, 
                    "Container recovered and is reporting healthy again.");
            }
            return CheckResult.CHANGED;
        } catch (RuntimeException e) {
            log.error("Unexpected error checking {}: {}", entityId, e.getMessage(), e);
            metricsRegistry.recordUnexpectedError("probe");
            return CheckResult.FAILED;
        } finally {
            LoggingContext.clearEntityContext();
        }
    }
    
    private int detectDisappeared(Set<String> previouslyTracked, List<EntityDescriptor> listed) {
        Set<String> running = listed.stream()
            .map(EntityDescriptor::entityId)
            .collect(Collectors.toSet());
        
        int disappeared = 0;
        for (String entityId : previouslyTracked) {
            if (running.contains(entityId)) {
                continue;
            }
            Optional<EntityRecord> record = stateStore.remove(entityId);
            if (record.isEmpty()) {
                continue;
            }
            
            EntityRecord gone = record.get();
            log.warn("[{}] {} is no longer running", gone.group(), entityId);
            alertDispatcher.dispatch(entityId, gone.group(), EntityStatus.NOT_FOUND, 
                gone.status(), DISAPPEARED_DETAILS);
            disappeared++;
        }
        return disappeared;
    }
    
    private int awaitChecks(List<Future<CheckResult>> futures, Map<CheckResult, Integer> counts) {
        Duration timeout = properties.getProbe().getPassTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        int pending = 0;
        
        for (Future<CheckResult> future : futures) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                CheckResult result = future.get(remaining, TimeUnit.NANOSECONDS);
                counts.merge(result, 1, Integer::sum);
            } catch (TimeoutException e) {
                pending++;
            } catch (ExecutionException e) {
                log.error("Probe task failed: {}", e.getCause().getMessage(), e.getCause());
                counts.merge(CheckResult.FAILED, 1, Integer::sum);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for probe tasks");
                pending += futures.size() - futures.indexOf(future);
                break;
            }
        }
        
        if (pending > 0) {
            log.warn("{} probe tasks still running after {}s", pending, timeout.toSeconds());
        }
        return pending;
    }
    
    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
    
    enum CheckResult {
        UNCHANGED,
        CHANGED,
        ARMED,
        SKIPPED,
        FAILED
    }
}
