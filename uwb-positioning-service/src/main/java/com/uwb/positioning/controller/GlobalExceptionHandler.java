package com.uwb.positioning.controller;

import com.uwb.positioning.exception.EmptyBatchException;
import com.uwb.positioning.exception.IngestionStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the ingestion endpoints.
 * Provides consistent error responses and logging.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    /**
     * Handles validation errors from @Valid annotations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors()
            .forEach((FieldError error) -> fieldErrors.put(error.getField(), error.getDefaultMessage()));

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Request validation failed");
        errorResponse.put("fieldErrors", fieldErrors);

        log.warn("Validation error: {}", fieldErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handles request bodies that are not valid JSON or do not match the request shape.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(errorBody(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body"));
    }

    /**
     * Handles batches without any usable input.
     */
    @ExceptionHandler(EmptyBatchException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyBatch(EmptyBatchException ex) {
        log.warn("Rejected empty batch: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(errorBody(HttpStatus.BAD_REQUEST, "Empty Batch", ex.getMessage()));
    }

    /**
     * Handles batches that could not be persisted. Nothing of the batch was committed.
     */
    @ExceptionHandler(IngestionStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageFailure(IngestionStorageException ex) {
        log.error("Ingestion storage error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", ex.getMessage()));
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred"));
    }

    private static Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put(TIMESTAMP, Instant.now());
        errorResponse.put(STATUS, status.value());
        errorResponse.put(ERROR, error);
        errorResponse.put(MESSAGE, message);
        return errorResponse;
    }
}
