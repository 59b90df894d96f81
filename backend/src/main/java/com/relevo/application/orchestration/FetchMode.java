/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

public enum FetchMode {
    SEQUENTIAL,
    /**
     * Members of a tier are tried concurrently, first validated success wins.
     */
    RACE
}
