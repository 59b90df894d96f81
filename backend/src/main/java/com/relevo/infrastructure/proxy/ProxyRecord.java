/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.proxy;

import java.time.Instant;

/**
 * Health of one proxy. Counters are guarded by the record's own monitor.
 */
public class ProxyRecord {
    private static final double LATENCY_SMOOTHING = 0.3;

    private final ProxyAddress address;
    private final boolean operatorSupplied;
    private final int maxFailures;

    private long successCount;
    private long failureCount;
    private double avgLatencyMs;
    private boolean active = true;
    private Instant lastUsedAt;

    public ProxyRecord(ProxyAddress address, boolean operatorSupplied, int maxFailures) {
        this.address = address;
        this.operatorSupplied = operatorSupplied;
        this.maxFailures = maxFailures;
    }

    public ProxyAddress address() {
        return address;
    }

    public boolean operatorSupplied() {
        return operatorSupplied;
    }

    public synchronized void recordSuccess(long latencyMs, Instant at) {
        successCount++;
        lastUsedAt = at;
        avgLatencyMs = avgLatencyMs == 0
                ? latencyMs
                : (1 - LATENCY_SMOOTHING) * avgLatencyMs + LATENCY_SMOOTHING * latencyMs;
    }

    public synchronized void recordFailure(Instant at) {
        failureCount++;
        lastUsedAt = at;
        if (failureCount > maxFailures) {
            active = false;
        }
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized double successRate() {
        long total = successCount + failureCount;
        return (double) successCount / (double) Math.max(total, 1);
    }

    public synchronized ProxySnapshot snapshot() {
        return new ProxySnapshot(address.toString(), operatorSupplied, active, successCount, failureCount,
                successRate(), avgLatencyMs, lastUsedAt);
    }

    public record ProxySnapshot(
            String address,
            boolean operatorSupplied,
            boolean active,
            long successCount,
            long failureCount,
            double successRate,
            double avgLatencyMs,
            Instant lastUsedAt
    ) {}
}
