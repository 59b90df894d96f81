/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.health;

import com.relevo.domain.model.FetchErrorType;

import java.time.Duration;
import java.util.List;

public interface HealthLedger {
    boolean isAvailable(String resourceId);

    void recordSuccess(String resourceId, Duration latency);

    void recordFailure(String resourceId, FetchErrorType type);

    double priorityScore(String resourceId);

    ResourceHealth snapshot(String resourceId);

    /**
     * Snapshots of every resource seen so far, ordered by id.
     */
    List<ResourceHealth> snapshots();
}
