package com.cliniq.engine.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to {@code {code, message, retryable, conflicts?}} JSON bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Object> buildErrorResponse(EngineException ex, HttpStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", ex.getCode());
        body.put("message", ex.getMessage());
        body.put("retryable", ex.isRetryable());
        if (ex instanceof ConflictException conflict) {
            body.put("conflicts", conflict.getConflicts());
        }
        return ResponseEntity.status(status).body(body);
    }

    // --- 400 Bad Request ---
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Object> handleValidation(ValidationException ex, WebRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.BAD_REQUEST);
    }

    // --- 404 Not Found ---
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Object> handleNotFound(NotFoundException ex, WebRequest request) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.NOT_FOUND);
    }

    // --- 409 Conflict ---
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Object> handleScheduleConflict(ConflictException ex, WebRequest request) {
        logger.warn("Schedule change rejected: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler({ AlreadyBookedException.class, StateException.class, ConcurrencyException.class })
    public ResponseEntity<Object> handleStateConflict(EngineException ex, WebRequest request) {
        logger.warn("Conflict ({}): {}", ex.getCode(), ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler({ ConcurrencyFailureException.class, DataIntegrityViolationException.class })
    public ResponseEntity<Object> handleLockFailure(RuntimeException ex, WebRequest request) {
        logger.warn("Concurrent modification: {}", ex.getMessage());
        return buildErrorResponse(new ConcurrencyException(
                "The resource was modified concurrently; retry the request", ex), HttpStatus.CONFLICT);
    }

    // --- 422 Unprocessable Entity ---
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Object> handleConfiguration(ConfigurationException ex, WebRequest request) {
        logger.warn("Doctor not configured: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    // --- 500 Internal Server Error (Generic Fallback) ---
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("An unexpected internal server error occurred:", ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", "INTERNAL_ERROR");
        body.put("message", "An unexpected internal error occurred.");
        body.put("retryable", false);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
