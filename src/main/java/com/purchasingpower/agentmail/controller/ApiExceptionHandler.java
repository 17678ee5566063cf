package com.purchasingpower.agentmail.controller;

import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.exception.FlowStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps flow errors on the operator endpoints to HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FlowNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(FlowNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "flow_not_found", e.getMessage());
    }

    @ExceptionHandler(FlowStateException.class)
    public ResponseEntity<Map<String, Object>> handleState(FlowStateException e) {
        log.info("Rejected operation on flow {}: {}", e.getFlowId(), e.getReason());
        return error(HttpStatus.CONFLICT, e.getReason().name().toLowerCase(Locale.ROOT), e.getMessage());
    }

    @ExceptionHandler(ConcurrentFlowUpdateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConcurrentFlowUpdateException e) {
        return error(HttpStatus.CONFLICT, "concurrent_update", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}
