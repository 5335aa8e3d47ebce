package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.model.Alert;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.testutil.RecordingNotifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertDispatcherTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final RecipientRouter router = new RecipientRouter(
        Map.of("billing", List.of("billing@example.com")), List.of("ops@example.com"));

    @Test
    void buildsAlertWithRoutedRecipientsAndClockTime() {
        RecordingNotifier notifier = new RecordingNotifier();
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(notifier), router,
            new MetricsRegistry(meterRegistry), clock);

        int delivered = dispatcher.dispatch("billing-api-1", "billing", EntityStatus.UNHEALTHY,
            EntityStatus.HEALTHY, "details");

        assertThat(delivered).isEqualTo(1);
        Alert alert = notifier.alerts().get(0);
        assertThat(alert.recipients()).containsExactly("billing@example.com");
        assertThat(alert.timestamp()).isEqualTo(clock.instant());
        assertThat(alert.previousStatus()).isEqualTo(EntityStatus.HEALTHY);
    }

    @Test
    void failingChannelDoesNotStopOthers() {
        RecordingNotifier failing = new RecordingNotifier();
        failing.setFailing(true);
        RecordingNotifier healthy = new RecordingNotifier();
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(failing, healthy), router,
            new MetricsRegistry(meterRegistry), clock);

        int delivered = dispatcher.dispatch("web-1", "shop", EntityStatus.NOT_FOUND, null, "gone");

        assertThat(delivered).isEqualTo(1);
        assertThat(healthy.alerts()).hasSize(1);
        assertThat(meterRegistry.get("healthmonitor.alert").tag("success", "false").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("healthmonitor.alert").tag("success", "true").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void noChannelsMeansNothingDelivered() {
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(), router,
            new MetricsRegistry(meterRegistry), clock);

        assertThat(dispatcher.dispatch("web-1", "shop", EntityStatus.UNHEALTHY, null, "x")).isZero();
    }
}
