/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FetchOptionsTest {

    @Test
    void deadlineMustBePositiveAndBounded() {
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.defaults().withDeadline(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.defaults().withDeadline(Duration.ofMillis(-5)));
        assertThrows(IllegalArgumentException.class,
                () -> FetchOptions.defaults().withDeadline(Duration.ofMillis(Long.MAX_VALUE)));
        assertThrows(IllegalArgumentException.class,
                () -> FetchOptions.defaults().withDeadline(FetchOptions.MAX_DEADLINE.plusMillis(1)));

        assertEquals(FetchOptions.MAX_DEADLINE, FetchOptions.defaults().withDeadline(FetchOptions.MAX_DEADLINE).deadline());
    }

    @Test
    void missingModeFallsBackToSequential() {
        assertEquals(FetchMode.SEQUENTIAL, new FetchOptions(null, 0, null).mode());
    }
}
