/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.health;

import com.relevo.domain.model.CircuitState;
import com.relevo.domain.model.FetchErrorType;

import java.time.Instant;

public record ResourceHealth(
        String resourceId,
        CircuitState circuitState,
        long successCount,
        long failureCount,
        int consecutiveFailures,
        double avgLatencyMs,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        Instant cooldownUntil,
        FetchErrorType lastErrorType
) {
    public long attempts() {
        return successCount + failureCount;
    }

    public double successRate() {
        long attempts = attempts();
        return attempts == 0 ? 0.0 : (double) successCount / (double) attempts;
    }

    static ResourceHealth unknown(String resourceId) {
        return new ResourceHealth(resourceId, CircuitState.CLOSED, 0, 0, 0, 0.0, null, null, null, null);
    }
}
