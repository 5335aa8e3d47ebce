package com.platform.healthmonitor.error;

import com.platform.healthmonitor.observability.LoggingConfig;
import com.platform.healthmonitor.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.UUID;

/**
 * Converts exceptions thrown by REST controllers into {@link ErrorResponse} bodies.
 * 
 * RULES:
 * - Never return HTTP 200 on failure
 * - Always include the error code
 * - Log recoverable errors at WARN, fatal ones at ERROR with stack trace
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        log.warn("[{}] Resource not found: {} ({})", traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(HealthMonitorException.class)
    public ResponseEntity<ErrorResponse> handleHealthMonitorException(
            HealthMonitorException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        return ResponseEntity.status(status).body(
            ErrorResponse.of(errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        String message = String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_REQUEST, message, 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        String message = String.format("Method %s not supported for this endpoint", ex.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ErrorResponse.of(
            ErrorCode.INVALID_REQUEST, message, HttpStatus.METHOD_NOT_ALLOWED.value(), 
            request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getDefaultMessage(), 
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("healthmonitor.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case ENTITY_NOT_FOUND, RESOURCE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SHUTDOWN_IN_PROGRESS -> HttpStatus.CONFLICT;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case PROBE_LIST_FAILED, PROBE_FAILED, PROBE_SOURCE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case NOTIFICATION_FAILED -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
