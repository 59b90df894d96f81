/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.ResourceTier;

import java.nio.charset.StandardCharsets;

public record FetchResult(
        byte[] payload,
        String resourceId,
        ResourceTier tier,
        AccessMethod accessMethod,
        int status,
        long latencyMs,
        int attempts
) {
    public String bodyAsString() {
        return payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
    }
}
