package com.example.configserver.exception;

import com.example.configserver.model.NotFoundResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP: not-found to the Spring-style 404, bad requests to 400,
 * everything else to a 500 whose detail stays in the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EnvironmentNotFoundException.class)
    public ResponseEntity<NotFoundResponse> handleEnvironmentNotFound(EnvironmentNotFoundException ex,
                                                                      ServerWebExchange exchange) {
        log.warn("Environment not found: {}", ex.getEnvironment());
        return notFound(exchange);
    }

    @ExceptionHandler(ConfigFileNotFoundException.class)
    public ResponseEntity<NotFoundResponse> handleFileNotFound(ConfigFileNotFoundException ex,
                                                               ServerWebExchange exchange) {
        log.debug("File not found: {}", ex.getMessage());
        return notFound(exchange);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Bad request");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Unmatched routes and framework-level status errors.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<?> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return notFound(exchange);
        }
        log.warn("Request failed with {}: {}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).build();
    }

    @ExceptionHandler(GitOperationException.class)
    public ResponseEntity<Map<String, Object>> handleGitFailure(GitOperationException ex) {
        log.error("Git {} failed: {}", ex.getStage(), ex.getStderr(), ex);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return internalError();
    }

    private ResponseEntity<NotFoundResponse> notFound(ServerWebExchange exchange) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .contentType(MediaType.APPLICATION_JSON)
            .body(NotFoundResponse.forPath(exchange.getRequest().getPath().value()));
    }

    private ResponseEntity<Map<String, Object>> internalError() {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Internal Server Error");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
