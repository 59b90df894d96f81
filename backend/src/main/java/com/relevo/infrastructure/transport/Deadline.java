/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

import java.time.Duration;

/**
 * Point on the monotonic clock after which no further outbound work should start. An unbounded
 * deadline never expires.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(0L, false);

    private final long expiresAtNanos;
    private final boolean bounded;

    private Deadline(long expiresAtNanos, boolean bounded) {
        this.expiresAtNanos = expiresAtNanos;
        this.bounded = bounded;
    }

    public static Deadline none() {
        return NONE;
    }

    /**
     * Deadline {@code budget} from now. Budgets too large for the nanosecond clock are unbounded.
     */
    public static Deadline after(Duration budget) {
        if (budget.isNegative()) throw new IllegalArgumentException("budget must not be negative");
        long nanos;
        try {
            nanos = budget.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long now = System.nanoTime();
        long expiresAt = now + nanos;
        if (expiresAt - now < 0) return NONE;
        return new Deadline(expiresAt, true);
    }

    /**
     * The earlier of this deadline and {@code budget} from now.
     */
    public Deadline within(Duration budget) {
        Deadline local = after(budget);
        if (!bounded) return local;
        if (!local.bounded) return this;
        return local.expiresAtNanos - expiresAtNanos < 0 ? local : this;
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isExpired() {
        return bounded && remainingNanos() <= 0;
    }

    /**
     * Nanoseconds left, never negative; {@link Long#MAX_VALUE} when unbounded.
     */
    public long remainingNanos() {
        if (!bounded) return Long.MAX_VALUE;
        return Math.max(0L, expiresAtNanos - System.nanoTime());
    }

    /**
     * {@code timeout}, shortened to what is left of this deadline.
     */
    public Duration cap(Duration timeout) {
        long left = remainingNanos();
        if (left == Long.MAX_VALUE) return timeout;
        return left < timeout.toNanos() ? Duration.ofNanos(left) : timeout;
    }

    @Override
    public String toString() {
        return bounded ? "Deadline[" + remainingNanos() / 1_000_000 + "ms left]" : "Deadline[none]";
    }
}
