package com.example.alertengine.controller;

import com.example.alertengine.exception.AlertStateException;
import com.example.alertengine.exception.ConcurrencyConflictException;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.exception.RoutingGapException;
import com.example.alertengine.exception.TimingInvariantException;
import com.example.alertengine.exception.UnknownEntityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({ConfigurationException.class, TimingInvariantException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", detail);
    }

    @ExceptionHandler(UnknownEntityException.class)
    public ResponseEntity<Map<String, Object>> notFound(UnknownEntityException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(RoutingGapException.class)
    public ResponseEntity<Map<String, Object>> routingGap(RoutingGapException e) {
        log.error("Routing gap surfaced to caller: {}", e.getMessage());
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, "routing_gap", e.getMessage());
        response.getBody().put("team_id", e.getTeamId());
        response.getBody().put("severity", e.getSeverity().code());
        response.getBody().put("level", e.getLevel());
        return response;
    }

    @ExceptionHandler(AlertStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(AlertStateException e) {
        return error(HttpStatus.CONFLICT, "invalid_state", e.getMessage());
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<Map<String, Object>> busy(ConcurrencyConflictException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "conflict_retry_exhausted", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
