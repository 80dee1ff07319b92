package com.deepansh.agentplatform.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IsolationViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIsolation(IsolationViolationException ex) {
        log.error("Isolation violation: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(errorBody("Access to another user's data is not allowed"));
    }

    @ExceptionHandler({ContextValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(RuntimeException ex) {
        return ResponseEntity.badRequest().body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler(AgentAlreadyRegisteredException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(AgentAlreadyRegisteredException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler({CircuitOpenException.class, ServiceUnavailableException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(AgentPlatformException ex) {
        log.warn("Dependency unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler(AgentPlatformException.class)
    public ResponseEntity<Map<String, Object>> handlePlatformException(AgentPlatformException ex) {
        log.error("Platform error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(String message) {
        return Map.of(
                "error", message != null ? message : "",
                "timestamp", Instant.now().toString()
        );
    }
}
