package com.platform.resourcecontroller.error;

import com.platform.resourcecontroller.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts exceptions raised by REST controllers to {@link ErrorResponse}.
 * Every error is logged and counted; fatal ones at error level.
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
        
        log.warn("[{}] Resource not found: {} ({})",
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder =
            baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, traceId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    @ExceptionHandler(OwningSystemException.class)
    public ResponseEntity<ErrorResponse> handleOwningSystem(
            OwningSystemException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] Owning system call failed: {} on {} - {}",
            traceId, ex.getOperation(), ex.getResourceType(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), status, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "operation", ex.getOperation()
            ))
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(ResourceControllerException.class)
    public ResponseEntity<ErrorResponse> handleResourceControllerException(
            ResourceControllerException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        ErrorResponse.ErrorResponseBuilder builder = baseResponse(errorCode, ex.getMessage(), status, request, traceId);
        if (ex.getCause() != null) {
            builder.detail(ex.getCause().getMessage());
        }
        return ResponseEntity.status(status).body(builder.build());
    }
    
    // ==================== Spring Validation ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.VALIDATION_ERROR,
                "Validation failed", HttpStatus.BAD_REQUEST, request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Database Errors ====================
    
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLocking(
            OptimisticLockingFailureException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Optimistic locking failure: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.OPTIMISTIC_LOCK_FAILURE);
        
        ErrorResponse response = baseResponse(ErrorCode.OPTIMISTIC_LOCK_FAILURE,
                "Resource was modified concurrently. Please retry.", HttpStatus.CONFLICT, request, traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Database error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.DATABASE_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.DATABASE_ERROR,
                "Database operation failed", HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST,
                "Invalid request body", HttpStatus.BAD_REQUEST, request, traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.UNEXPECTED_ERROR,
                "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private static ErrorResponse.ErrorResponseBuilder baseResponse(
            ErrorCode errorCode, String message, HttpStatus status, HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("resourcecontroller.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case OPTIMISTIC_LOCK_FAILURE -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, INVALID_FIELD_VALUE, RESERVED_ANNOTATION -> HttpStatus.BAD_REQUEST;
            case OWNING_SYSTEM_ERROR -> HttpStatus.BAD_GATEWAY;
            case CONFIG_VALIDATION_FAILED, INVALID_FIELD_PATH, UNSUPPORTED_PATH_KIND, TYPE_MISMATCH,
                 MERGE_FAILED, HOOK_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
