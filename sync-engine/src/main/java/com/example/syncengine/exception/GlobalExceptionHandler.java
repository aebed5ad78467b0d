package com.example.syncengine.exception;

import com.example.syncengine.dto.response.ErrorResponse;
import com.example.syncengine.error.ErrorClassification;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 * Converts exceptions to the ErrorResponse envelope.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * The session is already failed; the classification is returned so the client can offer recovery.
     */
    @ExceptionHandler(SyncFailedException.class)
    public ResponseEntity<ErrorResponse> handleSyncFailed(SyncFailedException ex) {
        log.warn("Sync failed: sessionId={}, {}", ex.getSessionId(), ex.getMessage());
        ErrorClassification classification = ex.getClassification();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sessionId", ex.getSessionId());
        if (classification != null) {
            details.put("category", classification.category());
            details.put("severity", classification.severity());
            details.put("retryable", classification.retryable());
            details.put("userMessage", classification.userMessage());
            details.put("recoveryStrategies", classification.recoveryStrategies());
        }
        return buildErrorResponse(ex.getStatus(), ex.getCode(), ex.getMessage(), null, details);
    }

    @ExceptionHandler(ReauthorizationRequiredException.class)
    public ResponseEntity<ErrorResponse> handleReauthorizationRequired(ReauthorizationRequiredException ex) {
        log.warn("Re-authorization required: {}", ex.getMessage());
        ErrorClassification classification = ex.getClassification();
        Map<String, Object> details = new LinkedHashMap<>();
        if (classification != null) {
            details.put("category", classification.category());
            details.put("retryable", classification.retryable());
            details.put("recoveryStrategies", classification.recoveryStrategies());
        }
        return buildErrorResponse(ex.getStatus(), ex.getCode(), ex.getMessage(), null, details);
    }

    @ExceptionHandler(SyncEngineException.class)
    public ResponseEntity<ErrorResponse> handleSyncEngineException(SyncEngineException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("{}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("{}: {}", ex.getCode(), ex.getMessage());
        }
        return buildErrorResponse(ex.getStatus(), ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        log.warn("Optimistic lock conflict: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.CONFLICT,
                "CONFLICT",
                "The resource was modified concurrently. Please refresh and retry.",
                null
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        String firstField = ex.getBindingResult().getFieldErrors().isEmpty()
                ? null
                : ex.getBindingResult().getFieldErrors().get(0).getField();
        String firstMessage = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "Validation failed"
                : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return buildErrorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", firstMessage, firstField, errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("Missing header: {}", ex.getHeaderName());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
                "Required header " + ex.getHeaderName() + " is missing", ex.getHeaderName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                "Invalid value for " + ex.getName(), ex.getName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("Illegal state: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred",
                null
        );
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String code, String message,
                                                             String field) {
        return buildErrorResponse(status, code, message, field, null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String code, String message,
                                                             String field, Object details) {
        ErrorResponse response = ErrorResponse.builder()
                .error(ErrorResponse.Error.builder()
                        .code(code)
                        .message(message)
                        .field(field)
                        .details(details)
                        .build())
                .timestamp(Instant.now().toString())
                .build();

        return ResponseEntity.status(status).body(response);
    }
}
