/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.access;

import com.relevo.domain.model.AccessMethod;
import com.relevo.infrastructure.transport.TransportResponse;

import java.util.List;

/**
 * @param trail every method tried for this call, in order, ending with {@code method}
 */
public record AccessResult(
        TransportResponse response,
        AccessMethod method,
        List<AccessMethod> trail,
        long latencyMs
) {
    public AccessResult {
        trail = List.copyOf(trail);
    }
}
