package com.platform.healthmonitor.docker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.docker.DockerModels.ContainerInspect;
import com.platform.healthmonitor.docker.DockerModels.ContainerSummary;
import com.platform.healthmonitor.error.EntityNotFoundException;
import com.platform.healthmonitor.error.ProbeSourceException;
import com.platform.healthmonitor.model.EntityDescriptor;
import com.platform.healthmonitor.model.EntityStatus;
import com.platform.healthmonitor.observability.MetricsRegistry;
import com.platform.healthmonitor.probe.ProbeSource;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Probe source backed by the Docker Engine REST API over TCP.
 * 
 * Every call goes through the {@code docker} circuit breaker. Server errors and
 * transport failures count against it; 404 answers are normal observations.
 */
@Slf4j
@Component
public class DockerEngineClient implements ProbeSource {
    
    static final String CIRCUIT_BREAKER_NAME = "docker";
    
    private static final Set<EntityStatus> HEALTH_STATUSES = 
        Set.of(EntityStatus.STARTING, EntityStatus.HEALTHY, EntityStatus.UNHEALTHY);
    private static final TypeReference<List<ContainerSummary>> CONTAINER_LIST = new TypeReference<>() {};
    
    private final HealthMonitorProperties.Docker config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreaker circuitBreaker;
    private final HttpClient httpClient;
    private final String baseUrl;
    
    public DockerEngineClient(
            HealthMonitorProperties properties,
            ObjectMapper objectMapper,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry) {
        this.config = properties.getDocker();
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .build();
        this.baseUrl = stripTrailingSlash(config.getHost()) + "/" + config.getApiVersion();
        
        registerEventListeners();
    }
    
    @PostConstruct
    public void checkAvailability() {
        try {
            HttpResponse<byte[]> response = send("/_ping", null, 
                (id, cause) -> ProbeSourceException.unavailable(id, describe(cause), cause));
            if (response.statusCode() == 200) {
                log.info("Docker engine available at {}", config.getHost());
            } else {
                log.warn("Docker engine at {} answered ping with HTTP {}", config.getHost(), response.statusCode());
            }
        } catch (ProbeSourceException e) {
            log.warn("Docker engine not reachable at {}: {}. Passes will abort until it is.", 
                config.getHost(), e.getMessage());
        }
    }
    
    @Override
    public List<EntityDescriptor> listEntities() {
        HttpResponse<byte[]> response = send("/containers/json", null, 
            (entityId, cause) -> ProbeSourceException.listFailed("Failed to list containers: " + describe(cause), cause));
        
        if (response.statusCode() != 200) {
            throw ProbeSourceException.listFailed("Container listing returned HTTP " + response.statusCode(), null);
        }
        
        try {
            List<ContainerSummary> containers = objectMapper.readValue(response.body(), CONTAINER_LIST);
            return containers.stream()
                .map(c -> {
                    String name = c.primaryName();
                    return new EntityDescriptor(name, ProjectNameResolver.resolve(name, c.getLabels()));
                })
                .toList();
        } catch (IOException e) {
            throw ProbeSourceException.listFailed("Malformed container listing: " + e.getMessage(), e);
        }
    }
    
    @Override
    public Optional<EntityStatus> probe(String entityId) {
        HttpResponse<byte[]> response = send("/containers/" + encode(entityId) + "/json", entityId, 
            (id, cause) -> ProbeSourceException.probeFailed(id, "Failed to inspect " + id + ": " + describe(cause), cause));
        
        if (response.statusCode() == 404) {
            throw new EntityNotFoundException(entityId);
        }
        if (response.statusCode() != 200) {
            throw ProbeSourceException.probeFailed(entityId, 
                "Inspect of " + entityId + " returned HTTP " + response.statusCode(), null);
        }
        
        ContainerInspect inspect;
        try {
            inspect = objectMapper.readValue(response.body(), ContainerInspect.class);
        } catch (IOException e) {
            throw ProbeSourceException.probeFailed(entityId, "Malformed inspect response: " + e.getMessage(), e);
        }
        
        if (inspect.getState() == null || inspect.getState().getHealth() == null) {
            return Optional.empty();
        }
        
        String healthStatus = inspect.getState().getHealth().getStatus();
        Optional<EntityStatus> status = EntityStatus.fromWireValue(healthStatus)
            .filter(HEALTH_STATUSES::contains);
        if (status.isEmpty()) {
            log.debug("{} reports health status '{}', treated as no healthcheck", entityId, healthStatus);
        }
        return status;
    }
    
    @Override
    public String recentDiagnostics(String entityId, int maxLines) {
        if (maxLines <= 0) {
            return "";
        }
        
        try {
            HttpResponse<byte[]> response = send(
                "/containers/" + encode(entityId) + "/logs?stdout=1&stderr=1&tail=" + maxLines, 
                entityId, 
                (id, cause) -> ProbeSourceException.probeFailed(id, describe(cause), cause));
            
            if (response.statusCode() == 404) {
                return "Container not found - may have been removed";
            }
            if (response.statusCode() != 200) {
                return "Could not retrieve logs: HTTP " + response.statusCode();
            }
            return DockerLogDecoder.decode(response.body());
        } catch (ProbeSourceException e) {
            log.debug("Log retrieval for {} failed: {}", entityId, e.getMessage());
            return "Could not retrieve logs: " + e.getMessage();
        }
    }
    
    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker.getState();
    }
    
    private HttpResponse<byte[]> send(
            String path, 
            String entityId, 
            BiFunction<String, Throwable, ProbeSourceException> failure) {
        if (!circuitBreaker.tryAcquirePermission()) {
            throw ProbeSourceException.unavailable(entityId, 
                "Docker circuit breaker is " + circuitBreaker.getState(), null);
        }
        
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(config.getRequestTimeout())
            .GET()
            .build();
        
        long start = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            throw failure.apply(entityId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releasePermission();
            throw failure.apply(entityId, e);
        }
        
        long elapsed = System.nanoTime() - start;
        metricsRegistry.recordLatency("docker", TimeUnit.NANOSECONDS.toMillis(elapsed));
        
        if (response.statusCode() >= 500) {
            IOException serverError = new IOException("Docker engine returned HTTP " + response.statusCode());
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, serverError);
            throw failure.apply(entityId, serverError);
        }
        
        circuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);
        return response;
    }
    
    private void registerEventListeners() {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String toState = event.getStateTransition().getToState().name();
                log.info("Circuit breaker {} state change: {} -> {}", CIRCUIT_BREAKER_NAME, 
                    event.getStateTransition().getFromState().name(), toState);
                metricsRegistry.incrementCounter("healthmonitor.docker.circuit", "state", toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}", 
                CIRCUIT_BREAKER_NAME, event.getThrowable().getMessage()));
    }
    
    private static String encode(String entityId) {
        return URLEncoder.encode(entityId, StandardCharsets.UTF_8);
    }
    
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
    
    private static String stripTrailingSlash(String host) {
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }
}
