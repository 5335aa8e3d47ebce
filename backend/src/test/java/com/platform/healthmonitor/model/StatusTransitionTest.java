package com.platform.healthmonitor.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusTransitionTest {

    private static StatusTransition transition(EntityStatus from, EntityStatus to) {
        return new StatusTransition("web-1", "shop", from, to);
    }

    @Test
    void firstObservationOfDegradedStatusNeedsConfirmation() {
        assertThat(transition(EntityStatus.UNKNOWN, EntityStatus.STARTING).becameDegraded()).isTrue();
        assertThat(transition(EntityStatus.HEALTHY, EntityStatus.UNHEALTHY).becameDegraded()).isTrue();
        assertThat(transition(EntityStatus.STARTING, EntityStatus.UNHEALTHY).becameDegraded()).isTrue();
    }

    @Test
    void unchangedStatusIsNotATransition() {
        StatusTransition same = transition(EntityStatus.UNHEALTHY, EntityStatus.UNHEALTHY);

        assertThat(same.changed()).isFalse();
        assertThat(same.becameDegraded()).isFalse();
    }

    @Test
    void recoveryRequiresDegradedPredecessor() {
        assertThat(transition(EntityStatus.UNHEALTHY, EntityStatus.HEALTHY).recovered()).isTrue();
        assertThat(transition(EntityStatus.STARTING, EntityStatus.HEALTHY).recovered()).isTrue();
        assertThat(transition(EntityStatus.UNKNOWN, EntityStatus.HEALTHY).recovered()).isFalse();
        assertThat(transition(EntityStatus.UNKNOWN, EntityStatus.HEALTHY).becameDegraded()).isFalse();
    }

    @Test
    void wireValuesRoundTripForDockerStatuses() {
        assertThat(EntityStatus.fromWireValue("healthy")).contains(EntityStatus.HEALTHY);
        assertThat(EntityStatus.fromWireValue(" Unhealthy ")).contains(EntityStatus.UNHEALTHY);
        assertThat(EntityStatus.fromWireValue("none")).isEmpty();
        assertThat(EntityStatus.fromWireValue(null)).isEmpty();
    }

    @Test
    void alertSeverityFollowsStatus() {
        Instant now = Instant.now();
        assertThat(new Alert("a", "g", EntityStatus.UNHEALTHY, null, "", List.of(), now).severity())
            .isEqualTo(Alert.Severity.CRITICAL);
        assertThat(new Alert("a", "g", EntityStatus.NOT_FOUND, null, "", List.of(), now).severity())
            .isEqualTo(Alert.Severity.ERROR);
        assertThat(new Alert("a", "g", EntityStatus.STARTING, null, "", List.of(), now).severity())
            .isEqualTo(Alert.Severity.WARNING);
        assertThat(new Alert("a", "g", EntityStatus.HEALTHY, EntityStatus.UNHEALTHY, "", List.of(), now).statusChange())
            .isEqualTo("unhealthy → healthy");
    }
}
