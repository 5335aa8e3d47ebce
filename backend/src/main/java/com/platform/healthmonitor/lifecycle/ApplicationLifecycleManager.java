package com.platform.healthmonitor.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the monitor's lifecycle phase and mirrors it into Spring Boot availability state.
 * 
 * STARTING until the context is ready, READY while passes run, DRAINING once shutdown
 * begins, STOPPED when the worker pool has been drained.
 */
@Slf4j
@Component
public class ApplicationLifecycleManager {
    
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final AtomicReference<LifecyclePhase> currentPhase = new AtomicReference<>(LifecyclePhase.STARTING);
    private volatile Instant phaseStartTime;
    
    public ApplicationLifecycleManager(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.phaseStartTime = clock.instant();
    }
    
    public void markReady() {
        if (currentPhase.compareAndSet(LifecyclePhase.STARTING, LifecyclePhase.READY)) {
            phaseStartTime = clock.instant();
            log.info("Monitor marked READY");
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);
        }
    }
    
    /**
     * Enter DRAINING. Has no effect once draining or stopped.
     */
    public void startDraining() {
        LifecyclePhase previous = currentPhase.getAndUpdate(
            phase -> phase == LifecyclePhase.STOPPED ? phase : LifecyclePhase.DRAINING);
        if (previous == LifecyclePhase.STARTING || previous == LifecyclePhase.READY) {
            phaseStartTime = clock.instant();
            log.info("Monitor entering DRAINING phase (was {})", previous);
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
        }
    }
    
    public void markStopped() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.STOPPED);
        if (previous != LifecyclePhase.STOPPED) {
            phaseStartTime = clock.instant();
            log.info("Monitor marked STOPPED (was {})", previous);
            AvailabilityChangeEvent.publish(eventPublisher, this, LivenessState.BROKEN);
        }
    }
    
    public LifecyclePhase getCurrentPhase() {
        return currentPhase.get();
    }
    
    public boolean isReady() {
        return currentPhase.get() == LifecyclePhase.READY;
    }
    
    public LifecycleStatus getStatus() {
        Instant since = phaseStartTime;
        return new LifecycleStatus(
            currentPhase.get(),
            since,
            Duration.between(since, clock.instant()).toMillis()
        );
    }
    
    public enum LifecyclePhase {
        STARTING,
        READY,
        DRAINING,
        STOPPED
    }
    
    public record LifecycleStatus(
        LifecyclePhase phase,
        Instant phaseStartTime,
        long durationMs
    ) {}
}
