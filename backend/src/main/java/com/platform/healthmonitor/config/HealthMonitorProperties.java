package com.platform.healthmonitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the container health monitor.
 * Validated at startup; an invalid configuration prevents the application from starting.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "healthmonitor")
public class HealthMonitorProperties {

    @Valid
    private Probe probe = new Probe();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Diagnostics diagnostics = new Diagnostics();

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Alert alert = new Alert();

    @Valid
    private Docker docker = new Docker();

    @Valid
    private Shutdown shutdown = new Shutdown();

    @Data
    public static class Probe {
        /**
         * Whether scheduled probe passes run at all.
         */
        private boolean enabled = true;

        /**
         * Cadence of probe passes in milliseconds.
         */
        @Min(1000)
        private long intervalMs = 30_000;

        /**
         * Upper bound on how long a pass waits for its probe tasks.
         */
        @NotNull
        private Duration passTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Retry {
        
        public static final Duration MAX_SLEEP_SLICE = Duration.ofSeconds(1);
        
        /**
         * Delay before the first re-probe of a degraded container.
         */
        @NotNull
        private Duration baseDelay = Duration.ofMinutes(15);

        private boolean backoffEnabled = false;

        @DecimalMin(value = "1.0", inclusive = false)
        private double multiplier = 2.0;

        /**
         * Cap applied to the exponential delay, before jitter.
         */
        @NotNull
        private Duration maxDelay = Duration.ofMinutes(60);

        /**
         * Upper bound of the uniform random jitter added to every delay.
         */
        @NotNull
        private Duration jitter = Duration.ZERO;

        @Min(1)
        private int maxAttempts = 3;

        /**
         * Longest uninterrupted wait inside a retry sleep, at most {@link #MAX_SLEEP_SLICE}.
         */
        @NotNull
        private Duration sleepSlice = MAX_SLEEP_SLICE;
        
        @AssertTrue(message = "must be positive and at most 1s")
        public boolean isSleepSliceInRange() {
            return sleepSlice == null
                || (!sleepSlice.isNegative() && !sleepSlice.isZero() && sleepSlice.compareTo(MAX_SLEEP_SLICE) <= 0);
        }
    }

    @Data
    public static class Diagnostics {
        /**
         * Number of trailing log lines attached to an escalation.
         */
        @Min(0)
        private int logLines = 10;
    }

    @Data
    public static class Pool {
        @Min(1)
        private int size = 30;

        private String threadNamePrefix = "probe-worker-";
    }

    @Data
    public static class Alert {
        /**
         * Server label shown in every alert.
         */
        private String serverName = "Production";

        @NotEmpty
        private List<String> defaultRecipients = new ArrayList<>();

        /**
         * Pattern to recipients. A pattern matches when contained in the container or project name.
         */
        private Map<String, List<String>> routing = new LinkedHashMap<>();

        /**
         * Send an immediate alert when a pass observes a degraded container turning healthy.
         */
        private boolean notifyOnRecovery = false;

        @Valid
        private Email email = new Email();

        @Valid
        private Kafka kafka = new Kafka();
    }

    @Data
    public static class Email {
        private boolean enabled = true;

        /**
         * Sender address; defaults to the SMTP user when blank.
         */
        private String from;
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;

        private String topic = "container-health-alerts";
    }

    @Data
    public static class Docker {
        /**
         * Docker Engine API endpoint (TCP).
         */
        private String host = "http://localhost:2375";

        private String apiVersion = "v1.43";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Shutdown {
        /**
         * Upper bound on draining in-flight tasks during shutdown.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }
}
