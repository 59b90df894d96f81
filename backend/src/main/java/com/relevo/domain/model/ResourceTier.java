/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

/**
 * Priority rank of a resource. Lower ordinal is tried first and a lower tier
 * always dominates any health score.
 */
public enum ResourceTier {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    EMERGENCY
}
