package com.platform.healthmonitor.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Worker pool shared by probe tasks and retry tasks.
 *
 * <p>Core and max size are equal, so the pool size is the only admission control:
 * the queue is unbounded and surplus submissions wait instead of being rejected.
 * Retry tasks occupy a worker for the whole of their backoff sleep, so the pool
 * should be sized above the number of containers expected to degrade at once.
 *
 * <p>Termination is left to {@code GracefulShutdownManager}, which cancels pending
 * retry sleeps before draining.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    private final HealthMonitorProperties properties;

    public ExecutorConfig(HealthMonitorProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor() {
        HealthMonitorProperties.Pool pool = properties.getPool();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getSize());
        executor.setMaxPoolSize(pool.getSize());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(properties.getShutdown().getTimeout().toMillis());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();

        log.info("Probe worker pool initialized (size={})", pool.getSize());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Copies the submitting thread's MDC into the worker for the duration of the task.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
