/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId,
        Map<String, Object> details
) {
    public ApiErrorResponse(String error, String code, String message, String requestId) {
        this(error, code, message, requestId, null);
    }
}
