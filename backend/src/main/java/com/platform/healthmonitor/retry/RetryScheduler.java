package com.platform.healthmonitor.retry;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.error.EntityNotFoundException;
import com.platform.healthmonitor.error.ProbeSourceException;
import com.platform.healthmonitor.lifecycle.CancellationToken;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.notify.AlertDispatcher;
import com.platform.healthmonitor.observability.LoggingContext;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.probe.ProbeSource;
import com.platform.healthmonitor.state.EntityStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Deferred re-probe of containers that transitioned into a degraded status.
 * 
 * A transition is only escalated once a second probe, taken after the backoff delay,
 * confirms it. At most one retry per container is queued or running at any time;
 * the registry slot is released before a follow-up attempt is armed, so a re-arm
 * goes through the same deduplication as any other caller.
 */
@Slf4j
@Service
public class RetryScheduler {
    
    static final String VANISHED_DETAILS = "Container disappeared during retry wait period.";
    
    private final ProbeSource probeSource;
    private final EntityStateStore stateStore;
    private final RetryRegistry registry;
    private final AlertDispatcher alertDispatcher;
    private final BackoffPolicy backoffPolicy;
    private final CancellationToken cancellationToken;
    private final AsyncTaskExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final int diagnosticLines;
    
    public RetryScheduler(
            ProbeSource probeSource,
            EntityStateStore stateStore,
            RetryRegistry registry,
            AlertDispatcher alertDispatcher,
            BackoffPolicy backoffPolicy,
            CancellationToken cancellationToken,
            @Qualifier("probeExecutor") AsyncTaskExecutor executor,
            MetricsRegistry metricsRegistry,
            Clock clock,
            HealthMonitorProperties properties) {
        this.probeSource = probeSource;
        this.stateStore = stateStore;
        this.registry = registry;
        this.alertDispatcher = alertDispatcher;
        this.backoffPolicy = backoffPolicy;
        this.cancellationToken = cancellationToken;
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.diagnosticLines = properties.getDiagnostics().getLogLines();
        
        metricsRegistry.registerGauge("healthmonitor.retry.active", 
            "Containers with a retry queued or running", registry::size);
    }
    
    /**
     * Arm the first retry for a container.
     * 
     * @return true if a task was queued, false if one is already armed or shutdown has begun
     */
    public boolean arm(String entityId, String group, EntityStatus previousStatus) {
        return arm(RetryTask.first(entityId, group, previousStatus));
    }
    
    public boolean arm(RetryTask task) {
        if (cancellationToken.isCancelled()) {
            log.debug("Not arming retry for {}: shutdown in progress", task.entityId());
            return false;
        }
        
        if (!registry.tryAcquire(task.entityId())) {
            log.debug("Retry already armed for {}, ignoring", task.entityId());
            metricsRegistry.recordRetryDeduplicated();
            return false;
        }
        
        Duration delay = backoffPolicy.delayFor(task.attempt());
        try {
            executor.execute(() -> runAndRelease(task, delay));
        } catch (TaskRejectedException e) {
            registry.release(task.entityId());
            log.warn("Retry for {} rejected by worker pool: {}", task.entityId(), e.getMessage());
            return false;
        }
        
        metricsRegistry.recordRetryArmed(task.attempt());
        log.info("[{}] {}: retry {}/{} scheduled in {}s", 
            task.group(), task.entityId(), task.attempt(), backoffPolicy.getMaxAttempts(), delay.toSeconds());
        return true;
    }
    
    public boolean isArmed(String entityId) {
        return registry.isArmed(entityId);
    }
    
    public Set<String> activeRetries() {
        return registry.snapshot();
    }
    
    private void runAndRelease(RetryTask task, Duration delay) {
        LoggingContext.setEntityContext(task.entityId(), task.group());
        RetryResult result;
        try {
            result = execute(task, delay);
        } catch (RuntimeException e) {
            log.error("Unexpected error in retry for {}: {}", task.entityId(), e.getMessage(), e);
            metricsRegistry.recordUnexpectedError("retry");
            result = RetryResult.of(RetryOutcome.FAILED);
        } finally {
            registry.release(task.entityId());
            LoggingContext.clearEntityContext();
        }
        
        metricsRegistry.recordRetryOutcome(result.outcome().tag());
        log.debug("Retry {} for {} ended: {}", task.attempt(), task.entityId(), result.outcome());
        result.next().ifPresent(this::arm);
    }
    
    RetryResult execute(RetryTask task, Duration delay) {
        if (!cancellationToken.sleep(delay)) {
            log.info("[{}] {}: retry abandoned, shutdown in progress", task.group(), task.entityId());
            return RetryResult.of(RetryOutcome.CANCELLED);
        }
        
        Optional<EntityStatus> observed;
        try {
            observed = probeSource.probe(task.entityId());
        } catch (EntityNotFoundException e) {
            // Whoever removes the record owns the NOT_FOUND alert; a pass may have got there first.
            if (stateStore.remove(task.entityId()).isEmpty()) {
                log.info("[{}] {}: disappearance already reported", task.group(), task.entityId());
                return RetryResult.of(RetryOutcome.VANISHED);
            }
            log.warn("[{}] {}: disappeared during retry wait", task.group(), task.entityId());
            alertDispatcher.dispatch(task.entityId(), task.group(), EntityStatus.NOT_FOUND,
                task.previousStatus(), VANISHED_DETAILS);
            return RetryResult.of(RetryOutcome.VANISHED);
        } catch (ProbeSourceException e) {
            return inconclusive(task, e);
        }
        
        if (observed.isEmpty()) {
            log.info("[{}] {}: no longer reports health, dropping retry", task.group(), task.entityId());
            return RetryResult.of(RetryOutcome.UNMONITORED);
        }
        
        EntityStatus current = observed.get();
        if (current.isHealthy()) {
            stateStore.upsert(task.entityId(), current, task.group(), clock.instant());
            log.info("[{}] {}: recovered before retry {}, no alert", 
                task.group(), task.entityId(), task.attempt());
            return RetryResult.of(RetryOutcome.RECOVERED);
        }
        
        String logs = probeSource.recentDiagnostics(task.entityId(), diagnosticLines);
        String details = String.format("Container remained %s after %d minutes.%n%nRecent logs:%n%s",
            current.getWireValue(), delay.toMinutes(), logs);
        
        alertDispatcher.dispatch(task.entityId(), task.group(), current, task.previousStatus(), details);
        stateStore.upsert(task.entityId(), current, task.group(), clock.instant());
        
        if (backoffPolicy.shouldRearmAfterEscalation(task.attempt())) {
            return RetryResult.rearm(RetryOutcome.ESCALATED, task.nextAttempt());
        }
        return RetryResult.of(RetryOutcome.ESCALATED);
    }
    
    private RetryResult inconclusive(RetryTask task, ProbeSourceException e) {
        if (backoffPolicy.hasAttemptsLeft(task.attempt())) {
            log.warn("[{}] {}: re-probe failed ({}), trying again", 
                task.group(), task.entityId(), e.getMessage());
            return RetryResult.rearm(RetryOutcome.INCONCLUSIVE, task.nextAttempt());
        }
        log.warn("[{}] {}: re-probe failed ({}) and no attempts left, giving up", 
            task.group(), task.entityId(), e.getMessage());
        return RetryResult.of(RetryOutcome.INCONCLUSIVE);
    }
    
    /**
     * Outcome of one attempt and the follow-up attempt to arm, if any.
     */
    record RetryResult(RetryOutcome outcome, Optional<RetryTask> next) {
        
        static RetryResult of(RetryOutcome outcome) {
            return new RetryResult(outcome, Optional.empty());
        }
        
        static RetryResult rearm(RetryOutcome outcome, RetryTask next) {
            return new RetryResult(outcome, Optional.of(next));
        }
    }
}
