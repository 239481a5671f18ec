package com.architecture.memory.traceback.controller;

import com.architecture.memory.traceback.exception.ExternalServiceUnavailableException;
import com.architecture.memory.traceback.exception.InvalidBusinessAreaException;
import com.architecture.memory.traceback.exception.SourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidBusinessAreaException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBusinessArea(InvalidBusinessAreaException e) {
        log.warn("Invalid business area: {}", e.getBusinessArea());
        return error(HttpStatus.BAD_REQUEST, "INVALID_BUSINESS_AREA", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    @ExceptionHandler(SourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSourceNotFound(SourceNotFoundException e) {
        log.warn(e.getMessage());
        return error(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ExternalServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleServiceUnavailable(ExternalServiceUnavailableException e) {
        log.error("External service error [{}]: {}", e.getService(), e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = Map.of(
                "timestamp", LocalDateTime.now().toString(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        );
        return ResponseEntity.status(status).body(body);
    }
}
