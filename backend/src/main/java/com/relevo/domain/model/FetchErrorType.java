/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

public enum FetchErrorType {
    TIMEOUT(false),
    RATE_LIMITED(true),
    NETWORK_UNREACHABLE(false),
    UPSTREAM_ERROR(false);

    private final boolean forcesLongCooldown;

    FetchErrorType(boolean forcesLongCooldown) {
        this.forcesLongCooldown = forcesLongCooldown;
    }

    public boolean forcesLongCooldown() {
        return forcesLongCooldown;
    }
}
