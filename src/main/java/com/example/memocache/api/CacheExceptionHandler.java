package com.example.memocache.api;

import com.example.memocache.backend.BackendUnavailableException;
import com.example.memocache.core.CacheTimeoutException;
import com.example.memocache.key.UnencodableArgumentException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps cache and backend failures to HTTP responses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class CacheExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CacheExceptionHandler.class);

    @ExceptionHandler(UnencodableArgumentException.class)
    public ResponseEntity<Map<String, String>> handleUnencodable(UnencodableArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "UNENCODABLE_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(CacheTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(CacheTimeoutException e) {
        log.warn("[CacheController] {}", e.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, "COMPUTATION_TIMEOUT", e.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleBackend(BackendUnavailableException e) {
        return body(HttpStatus.BAD_GATEWAY, "BACKEND_UNAVAILABLE", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
