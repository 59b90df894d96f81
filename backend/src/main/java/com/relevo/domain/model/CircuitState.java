/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
