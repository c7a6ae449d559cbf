package com.banklink.api.controller;

import com.banklink.common.exception.BankLinkException;
import com.banklink.common.exception.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 *
 * Error body: {@code {"error", "category", "status"}}. The category is what
 * remote callers use to re-raise the typed exception.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, String>> handleRateLimited(RateLimitedException e) {
        HttpHeaders headers = new HttpHeaders();
        if (e.getRetryAfterSeconds() > 0) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .headers(headers)
            .body(body(HttpStatus.TOO_MANY_REQUESTS, e.getCategory().name(), e.getMessage()));
    }

    @ExceptionHandler(BankLinkException.class)
    public ResponseEntity<Map<String, String>> handleBankLink(BankLinkException e) {
        HttpStatus status = e.getCategory().getHttpStatus();
        if (status.is5xxServerError()) {
            log.warn("Request failed: {} {}", e.getCategory(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body(status, e.getCategory().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        errors.put("category", "INVALID_INPUT");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "An unexpected error occurred"));
    }

    private static Map<String, String> body(HttpStatus status, String category, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("category", category);
        error.put("status", String.valueOf(status.value()));
        return error;
    }
}
