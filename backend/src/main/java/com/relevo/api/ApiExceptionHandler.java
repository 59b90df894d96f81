/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.api;

import com.relevo.application.orchestration.ExhaustedException;
import com.relevo.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage(), null);
    }

    /**
     * Every candidate failed; the caller gets which resources were tried and how each one failed.
     */
    @ExceptionHandler(ExhaustedException.class)
    public ResponseEntity<ApiErrorResponse> handleExhausted(ExhaustedException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", ex.getCategory());
        details.put("attempted", ex.getAttempted());
        details.put("failures", ex.getFailures());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "RESOURCES_EXHAUSTED", ex.getMessage(), details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error", null);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message, Map<String, Object> details) {
        ApiErrorResponse body = new ApiErrorResponse(status.name(), code, message, currentRequestId(), details);
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
