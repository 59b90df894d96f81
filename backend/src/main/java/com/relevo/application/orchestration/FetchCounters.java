/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.domain.model.ResourceTier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrator-wide counters. Writers take the write lock so a reader always sees one consistent cut
 * across every counter.
 */
@Component
public class FetchCounters {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long totalRequests;
    private long successfulRequests;
    private long exhaustedRequests;
    private final Map<ResourceTier, Long> winsByTier = new EnumMap<>(ResourceTier.class);
    private final Map<String, Long> attemptsByResource = new TreeMap<>();
    private final Map<String, Long> successesByResource = new TreeMap<>();

    void recordRequest() {
        lock.writeLock().lock();
        try {
            totalRequests++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordAttempt(String resourceId, boolean success) {
        lock.writeLock().lock();
        try {
            attemptsByResource.merge(resourceId, 1L, Long::sum);
            if (success) successesByResource.merge(resourceId, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordWin(ResourceTier tier) {
        lock.writeLock().lock();
        try {
            successfulRequests++;
            winsByTier.merge(tier, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordExhausted() {
        lock.writeLock().lock();
        try {
            exhaustedRequests++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<ResourceTier, Long> tiers = new LinkedHashMap<>();
            for (ResourceTier tier : ResourceTier.values()) {
                tiers.put(tier, winsByTier.getOrDefault(tier, 0L));
            }
            return new Snapshot(
                    totalRequests,
                    successfulRequests,
                    exhaustedRequests,
                    Collections.unmodifiableMap(tiers),
                    Collections.unmodifiableMap(new TreeMap<>(attemptsByResource)),
                    Collections.unmodifiableMap(new TreeMap<>(successesByResource))
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    public record Snapshot(
            long totalRequests,
            long successfulRequests,
            long exhaustedRequests,
            Map<ResourceTier, Long> winsByTier,
            Map<String, Long> attemptsByResource,
            Map<String, Long> successesByResource
    ) {}
}
