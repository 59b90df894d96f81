/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.statistics;

/**
 * Live circuit view of one category; changes as cooldowns elapse.
 */
public record CategoryAvailability(
        String category,
        int total,
        int available,
        int circuitOpen,
        int rateLimited,
        double successRate
) {}
