/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import java.time.Duration;

/**
 * @param raceWidth how many members of a tier run at once in {@link FetchMode#RACE}; zero means the
 *                  configured maximum
 * @param deadline  overall budget for the whole fetch, at most {@link #MAX_DEADLINE}, or null for none
 */
public record FetchOptions(FetchMode mode, int raceWidth, Duration deadline) {
    public static final Duration MAX_DEADLINE = Duration.ofMinutes(10);
    private static final FetchOptions DEFAULTS = new FetchOptions(FetchMode.SEQUENTIAL, 0, null);

    public FetchOptions {
        if (mode == null) mode = FetchMode.SEQUENTIAL;
        if (raceWidth < 0) throw new IllegalArgumentException("raceWidth must not be negative");
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        if (deadline != null && deadline.compareTo(MAX_DEADLINE) > 0) {
            throw new IllegalArgumentException("deadline must not exceed " + MAX_DEADLINE.toMillis() + " ms");
        }
    }

    public static FetchOptions defaults() {
        return DEFAULTS;
    }

    public static FetchOptions race(int width) {
        return new FetchOptions(FetchMode.RACE, width, null);
    }

    public FetchOptions withDeadline(Duration value) {
        return new FetchOptions(mode, raceWidth, value);
    }
}
