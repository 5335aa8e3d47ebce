package com.platform.healthmonitor.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HealthMonitorPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static HealthMonitorProperties valid() {
        HealthMonitorProperties properties = new HealthMonitorProperties();
        properties.getAlert().setDefaultRecipients(List.of("ops@example.com"));
        return properties;
    }

    @Test
    void defaultsAreValidOnceRecipientsAreSet() {
        HealthMonitorProperties properties = valid();

        assertThat(validator.validate(properties)).isEmpty();
        assertThat(properties.getRetry().getBaseDelay()).isEqualTo(Duration.ofMinutes(15));
        assertThat(properties.getRetry().isBackoffEnabled()).isFalse();
        assertThat(properties.getPool().getSize()).isEqualTo(30);
        assertThat(properties.getAlert().isNotifyOnRecovery()).isFalse();
    }

    @Test
    void missingRecipientsAreRejected() {
        Set<ConstraintViolation<HealthMonitorProperties>> violations = validator.validate(new HealthMonitorProperties());

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
            .containsExactly("alert.defaultRecipients");
    }

    @Test
    void multiplierMustExceedOne() {
        HealthMonitorProperties properties = valid();
        properties.getRetry().setMultiplier(1.0);
        properties.getRetry().setMaxAttempts(0);

        assertThat(validator.validate(properties)).extracting(v -> v.getPropertyPath().toString())
            .containsExactlyInAnyOrder("retry.multiplier", "retry.maxAttempts");
    }

    @Test
    void sleepSliceIsBoundedToOneSecond() {
        HealthMonitorProperties properties = valid();
        properties.getRetry().setSleepSlice(Duration.ofSeconds(5));

        assertThat(validator.validate(properties)).extracting(v -> v.getPropertyPath().toString())
            .containsExactly("retry.sleepSliceInRange");

        properties.getRetry().setSleepSlice(Duration.ofMillis(250));
        assertThat(validator.validate(properties)).isEmpty();
    }
}
