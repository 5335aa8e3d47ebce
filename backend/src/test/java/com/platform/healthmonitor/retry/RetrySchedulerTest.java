package com.platform.healthmonitor.retry;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.lifecycle.CancellationToken;
import com.platform.healthmonitor.model.Alert;
import com.platform.healthmonitor.model.EntityDescriptor;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.probe.ProbeSource;
import com.platform.healthmonitor.state.EntityStateStore;
import com.platform.healthmonitor.testutil.FakeProbeSource;
import com.platform.healthmonitor.testutil.RecordingNotifier;
import com.platform.healthmonitor.testutil.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RetrySchedulerTest {

    private final FakeProbeSource source = new FakeProbeSource();
    private final EntityStateStore store = new EntityStateStore();
    private final RetryRegistry registry = new RetryRegistry();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final MetricsRegistry metrics = TestFixtures.metrics();

    private HealthMonitorProperties properties;
    private CancellationToken token;
    private ThreadPoolTaskExecutor executor;
    private RetryScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.fastProperties();
        source.running("web-1", "shop", EntityStatus.UNHEALTHY);
        store.upsert("web-1", EntityStatus.UNHEALTHY, "shop", Instant.now());
    }

    @AfterEach
    void tearDown() {
        if (token != null) {
            token.cancel();
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    private void start() {
        start(source);
    }

    private void start(ProbeSource probeSource) {
        token = new CancellationToken(properties.getRetry().getSleepSlice());
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("retry-test-");
        executor.initialize();
        scheduler = new RetryScheduler(
            probeSource,
            store,
            registry,
            TestFixtures.dispatcher(metrics, notifier),
            new BackoffPolicy(properties.getRetry(), () -> 0.0),
            token,
            executor,
            metrics,
            Clock.systemUTC(),
            properties
        );
    }

    private void awaitIdle() {
        await().atMost(Duration.ofSeconds(5)).until(() -> !scheduler.isArmed("web-1"));
    }

    @Test
    void recoveryBeforeRetryIsSilent() {
        start();
        source.setStatus("web-1", EntityStatus.HEALTHY);

        assertThat(scheduler.arm("web-1", "shop", EntityStatus.HEALTHY)).isTrue();
        awaitIdle();

        assertThat(notifier.alerts()).isEmpty();
        assertThat(store.statusOf("web-1")).isEqualTo(EntityStatus.HEALTHY);
    }

    @Test
    void persistentDegradationEscalatesOnceWithPreTransitionStatus() {
        start();
        source.setLogs("ERROR connection refused");

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(notifier.alerts()).hasSize(1);
        Alert alert = notifier.alerts().get(0);
        assertThat(alert.status()).isEqualTo(EntityStatus.UNHEALTHY);
        assertThat(alert.previousStatus()).isEqualTo(EntityStatus.HEALTHY);
        assertThat(alert.group()).isEqualTo("shop");
        assertThat(alert.recipients()).containsExactly(TestFixtures.OPS);
        assertThat(alert.details())
            .startsWith("Container remained unhealthy after")
            .contains("Recent logs:")
            .contains("ERROR connection refused");
        assertThat(store.statusOf("web-1")).isEqualTo(EntityStatus.UNHEALTHY);
    }

    @Test
    void backoffReArmsUntilMaxAttempts() {
        properties.getRetry().setBackoffEnabled(true);
        properties.getRetry().setBaseDelay(Duration.ofMillis(20));
        properties.getRetry().setMaxAttempts(3);
        start();

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);

        await().atMost(Duration.ofSeconds(5))
            .until(() -> notifier.alerts().size() == 3 && !scheduler.isArmed("web-1"));
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
            .until(() -> notifier.alerts().size() == 3);

        assertThat(source.probeCount("web-1")).isEqualTo(3);
        assertThat(notifier.alerts())
            .extracting(Alert::previousStatus)
            .containsOnly(EntityStatus.HEALTHY);
    }

    @Test
    void reArmedRetryStopsOnceRecovered() {
        properties.getRetry().setBackoffEnabled(true);
        properties.getRetry().setBaseDelay(Duration.ofMillis(300));
        properties.getRetry().setMaxAttempts(5);
        start();

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        await().pollInterval(Duration.ofMillis(5)).atMost(Duration.ofSeconds(5))
            .until(() -> notifier.alerts().size() == 1);
        source.setStatus("web-1", EntityStatus.HEALTHY);

        await().atMost(Duration.ofSeconds(5)).until(() -> store.statusOf("web-1") == EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(notifier.alerts()).hasSize(1);
    }

    @Test
    void entityGoneDuringWaitIsReportedAndForgotten() {
        start();
        source.stop("web-1");

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(notifier.alerts()).hasSize(1);
        Alert alert = notifier.alerts().get(0);
        assertThat(alert.status()).isEqualTo(EntityStatus.NOT_FOUND);
        assertThat(alert.details()).isEqualTo(RetryScheduler.VANISHED_DETAILS);
        assertThat(store.get("web-1")).isEmpty();
    }

    @Test
    void disappearanceAlreadyReportedIsNotAlertedAgain() {
        start();
        source.stop("web-1");
        store.remove("web-1");

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(source.probeCount("web-1")).isEqualTo(1);
        assertThat(notifier.alerts()).isEmpty();
    }

    @Test
    void entityWithoutHealthInformationIsDroppedSilently() {
        start();
        source.clearHealth("web-1");

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(notifier.alerts()).isEmpty();
        assertThat(store.statusOf("web-1")).isEqualTo(EntityStatus.UNHEALTHY);
    }

    @Test
    void secondArmWhileInFlightIsRejected() {
        properties.getRetry().setBaseDelay(Duration.ofMillis(200));
        start();

        assertThat(scheduler.arm("web-1", "shop", EntityStatus.HEALTHY)).isTrue();
        assertThat(scheduler.arm("web-1", "shop", EntityStatus.STARTING)).isFalse();
        assertThat(scheduler.activeRetries()).containsExactly("web-1");
        awaitIdle();

        assertThat(source.probeCount("web-1")).isEqualTo(1);
        assertThat(notifier.alerts()).hasSize(1);
    }

    @Test
    void cancellationAbandonsSleepingRetryWithoutProbing() {
        properties.getRetry().setBaseDelay(Duration.ofMinutes(10));
        start();

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        token.cancel();

        await().atMost(Duration.ofSeconds(1)).until(() -> !scheduler.isArmed("web-1"));
        assertThat(source.probeCount("web-1")).isZero();
        assertThat(notifier.alerts()).isEmpty();
        assertThat(scheduler.arm("web-1", "shop", EntityStatus.HEALTHY)).isFalse();
    }

    @Test
    void failedReProbeIsRetriedWithoutAlerting() {
        properties.getRetry().setMaxAttempts(2);
        start();
        source.failProbes("web-1", true);

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);

        await().atMost(Duration.ofSeconds(5))
            .until(() -> source.probeCount("web-1") == 2 && !scheduler.isArmed("web-1"));
        assertThat(notifier.alerts()).isEmpty();
        assertThat(store.statusOf("web-1")).isEqualTo(EntityStatus.UNHEALTHY);
    }

    @Test
    void notifierFailureDoesNotBlockStateUpdateOrRelease() {
        start();
        notifier.setFailing(true);
        source.setStatus("web-1", EntityStatus.STARTING);

        scheduler.arm("web-1", "shop", EntityStatus.HEALTHY);
        awaitIdle();

        assertThat(notifier.alerts()).hasSize(1);
        assertThat(store.statusOf("web-1")).isEqualTo(EntityStatus.STARTING);
        assertThat(scheduler.arm("web-1", "shop", EntityStatus.HEALTHY)).isTrue();
    }

    @RepeatedTest(5)
    void concurrentArmsAndReArmsNeverOverlapForOneEntity() throws Exception {
        properties.getRetry().setBackoffEnabled(true);
        properties.getRetry().setBaseDelay(Duration.ofMillis(5));
        properties.getRetry().setMaxDelay(Duration.ofMillis(40));
        properties.getRetry().setSleepSlice(Duration.ofMillis(5));
        properties.getRetry().setMaxAttempts(4);
        List<String> ids = List.of("web-1", "api-1", "db-1");
        OverlapDetectingSource overlapSource = new OverlapDetectingSource();
        start(overlapSource);

        int threads = 8;
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> callers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Thread caller = new Thread(() -> {
                ready.countDown();
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                ThreadLocalRandom random = ThreadLocalRandom.current();
                for (int n = 0; n < 200; n++) {
                    String id = ids.get(random.nextInt(ids.size()));
                    scheduler.arm(id, "shop", EntityStatus.HEALTHY);
                    if (random.nextInt(4) == 0) {
                        Thread.yield();
                    }
                }
            }, "arm-caller-" + i);
            callers.add(caller);
            caller.start();
        }

        assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
        go.countDown();
        for (Thread caller : callers) {
            caller.join(TimeUnit.SECONDS.toMillis(10));
        }
        await().atMost(Duration.ofSeconds(10))
            .until(() -> ids.stream().noneMatch(scheduler::isArmed));

        assertThat(overlapSource.totalProbes()).isPositive();
        assertThat(notifier.alerts()).isNotEmpty();
        ids.forEach(id -> assertThat(overlapSource.maxConcurrent(id))
            .as("concurrent re-probes of %s", id)
            .isLessThanOrEqualTo(1));
    }

    /**
     * Always unhealthy; records the highest number of simultaneous probes per container.
     */
    private static final class OverlapDetectingSource implements ProbeSource {

        private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> maxSeen = new ConcurrentHashMap<>();
        private final AtomicInteger total = new AtomicInteger();

        @Override
        public List<EntityDescriptor> listEntities() {
            return List.of();
        }

        @Override
        public Optional<EntityStatus> probe(String entityId) {
            total.incrementAndGet();
            int now = inFlight.computeIfAbsent(entityId, k -> new AtomicInteger()).incrementAndGet();
            maxSeen.computeIfAbsent(entityId, k -> new AtomicInteger()).accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.get(entityId).decrementAndGet();
            }
            return Optional.of(EntityStatus.UNHEALTHY);
        }

        @Override
        public String recentDiagnostics(String entityId, int maxLines) {
            return "";
        }

        int maxConcurrent(String entityId) {
            AtomicInteger seen = maxSeen.get(entityId);
            return seen == null ? 0 : seen.get();
        }

        int totalProbes() {
            return total.get();
        }
    }
}
