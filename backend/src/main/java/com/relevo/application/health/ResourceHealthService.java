/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.health;

import com.relevo.config.AppProperties;
import com.relevo.domain.model.CircuitState;
import com.relevo.domain.model.FetchErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory circuit breaker per resource. Each record is guarded by its own monitor, so updates to
 * different resources never contend.
 */
@Service
public class ResourceHealthService implements HealthLedger {
    private static final Logger log = LoggerFactory.getLogger(ResourceHealthService.class);

    static final Duration RECENT_SUCCESS_WINDOW = Duration.ofMinutes(5);
    private static final double SLOW_LATENCY_SECONDS = 5.0;

    private final ConcurrentMap<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final AppProperties.Fetch config;
    private final Clock clock;

    @Autowired
    public ResourceHealthService(AppProperties properties, Clock clock) {
        this(properties.fetch(), clock);
    }

    ResourceHealthService(AppProperties.Fetch config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean isAvailable(String resourceId) {
        HealthRecord record = records.get(resourceId);
        if (record == null) return true;
        synchronized (record) {
            return record.effectiveState(clock.instant()) != CircuitState.OPEN;
        }
    }

    @Override
    public void recordSuccess(String resourceId, Duration latency) {
        HealthRecord record = recordFor(resourceId);
        Instant now = clock.instant();
        synchronized (record) {
            CircuitState before = record.effectiveState(now);
            double latencyMs = latency == null ? 0.0 : latency.toNanos() / 1_000_000.0;
            record.avgLatencyMs = record.successCount == 0
                    ? latencyMs
                    : (1 - config.latencySmoothing()) * record.avgLatencyMs + config.latencySmoothing() * latencyMs;
            record.successCount++;
            record.consecutiveFailures = 0;
            record.lastSuccessAt = now;
            if (before == CircuitState.HALF_OPEN) {
                record.state = CircuitState.CLOSED;
                record.cooldownUntil = null;
                log.info("Circuit closed resource={}", resourceId);
            }
        }
    }

    @Override
    public void recordFailure(String resourceId, FetchErrorType type) {
        HealthRecord record = recordFor(resourceId);
        Instant now = clock.instant();
        synchronized (record) {
            CircuitState before = record.effectiveState(now);
            record.failureCount++;
            record.consecutiveFailures++;
            record.lastFailureAt = now;
            record.lastErrorType = type;

            if (type != null && type.forcesLongCooldown()) {
                record.open(now.plus(config.rateLimitCooldown()));
                log.warn("Circuit opened resource={} reason={} until={}", resourceId, type, record.cooldownUntil);
            } else if (before == CircuitState.HALF_OPEN || record.consecutiveFailures >= config.failureThreshold()) {
                record.open(now.plus(config.fixedCooldown()));
                log.warn("Circuit opened resource={} reason={} consecutiveFailures={} until={}",
                        resourceId, type, record.consecutiveFailures, record.cooldownUntil);
            }
        }
    }

    @Override
    public double priorityScore(String resourceId) {
        HealthRecord record = records.get(resourceId);
        if (record == null) return 0.0;
        Instant now = clock.instant();
        synchronized (record) {
            long attempts = record.successCount + record.failureCount;
            if (attempts == 0) return 0.0;
            double successRate = (double) record.successCount / (double) attempts;
            double recency = record.lastSuccessAt != null
                    && Duration.between(record.lastSuccessAt, now).compareTo(RECENT_SUCCESS_WINDOW) < 0 ? 1.0 : 0.5;
            double speed = Math.max(0.5, 1.0 - (record.avgLatencyMs / 1000.0) / SLOW_LATENCY_SECONDS);
            return successRate * recency * speed;
        }
    }

    @Override
    public ResourceHealth snapshot(String resourceId) {
        HealthRecord record = records.get(resourceId);
        if (record == null) return ResourceHealth.unknown(resourceId);
        synchronized (record) {
            return record.toSnapshot(resourceId, clock.instant());
        }
    }

    @Override
    public List<ResourceHealth> snapshots() {
        return records.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(this::snapshot)
                .toList();
    }

    private HealthRecord recordFor(String resourceId) {
        return records.computeIfAbsent(resourceId, id -> new HealthRecord());
    }

    private static final class HealthRecord {
        private CircuitState state = CircuitState.CLOSED;
        private long successCount;
        private long failureCount;
        private int consecutiveFailures;
        private double avgLatencyMs;
        private Instant lastSuccessAt;
        private Instant lastFailureAt;
        private Instant cooldownUntil;
        private FetchErrorType lastErrorType;

        CircuitState effectiveState(Instant now) {
            if (state == CircuitState.OPEN && (cooldownUntil == null || !now.isBefore(cooldownUntil))) {
                state = CircuitState.HALF_OPEN;
            }
            return state;
        }

        void open(Instant until) {
            state = CircuitState.OPEN;
            // an open circuit never shortens its cooldown
            if (cooldownUntil == null || until.isAfter(cooldownUntil)) cooldownUntil = until;
        }

        ResourceHealth toSnapshot(String resourceId, Instant now) {
            return new ResourceHealth(
                    resourceId,
                    effectiveState(now),
                    successCount,
                    failureCount,
                    consecutiveFailures,
                    avgLatencyMs,
                    lastSuccessAt,
                    lastFailureAt,
                    cooldownUntil,
                    lastErrorType
            );
        }
    }
}
