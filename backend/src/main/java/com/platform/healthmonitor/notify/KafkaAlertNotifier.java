package com.platform.healthmonitor.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.error.NotificationException;
import com.platform.healthmonitor.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes alerts as JSON events keyed by container name.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "healthmonitor.alert.kafka.enabled", havingValue = "true")
public class KafkaAlertNotifier implements AlertNotifier {
    
    private static final long SEND_TIMEOUT_SECONDS = 10;
    
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    
    public KafkaAlertNotifier(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            HealthMonitorProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = properties.getAlert().getKafka().getTopic();
        log.info("Kafka alert channel publishing to topic {}", topic);
    }
    
    @Override
    public String channel() {
        return "kafka";
    }
    
    @Override
    public void notify(Alert alert) {
        HealthAlertEvent event = HealthAlertEvent.from(alert);
        try {
            String payload = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, alert.entityId(), payload)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Alert event {} published for {}", event.eventId(), alert.entityId());
        } catch (JsonProcessingException e) {
            throw new NotificationException(channel(), "Failed to serialize alert event", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(channel(), "Interrupted while publishing alert event", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NotificationException(channel(), 
                "Failed to publish alert event for " + alert.entityId() + ": " + e.getMessage(), e);
        }
    }
}
