package com.hyperfix.labels.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps request problems to JSON error bodies. The label pipeline itself never throws; every
 * error reaching this class comes from request binding or request limits.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getAllErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("object", err.getObjectName());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        log.warn("Request failed with {}: {}", ex.getStatusCode(), ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getStatusCode().is4xxClientError() ? "client_error" : "server_error");
        body.put("reason", ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }
}
