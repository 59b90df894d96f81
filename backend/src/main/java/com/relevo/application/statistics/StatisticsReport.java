/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.statistics;

import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.ResourceTier;
import com.relevo.infrastructure.access.AccessStatistics;

import java.util.List;
import java.util.Map;

/**
 * Counter-derived view of orchestrator activity. Contains nothing that changes with the wall clock,
 * so two reports taken without a fetch in between are equal.
 */
public record StatisticsReport(
        Overview overview,
        Utilization utilization,
        Map<ResourceTier, Long> tierDistribution,
        List<ResourceUsage> resources,
        HealthBreakdown health,
        List<ResourceUsage> topPerformers,
        List<ResourceUsage> mostUsed,
        List<ResourceUsage> worstPerformers,
        Map<String, CategoryUsage> categories,
        Map<AccessMethod, AccessStatistics.MethodCounts> accessMethods
) {
    public record Overview(long totalRequests, long successfulRequests, long exhaustedRequests, double successRate) {}

    public record Utilization(int totalResources, int resourcesUsed, int resourcesSuccessful, double utilizationRate) {}

    public record ResourceUsage(
            String id,
            String category,
            ResourceTier tier,
            long attempts,
            long successes,
            long failures,
            double successRate,
            double avgLatencyMs,
            UsageClass classification
    ) {}

    public enum UsageClass {
        HEALTHY,
        DEGRADED,
        FAILED,
        UNUSED
    }

    public record HealthBreakdown(List<String> healthy, List<String> degraded, List<String> failed, List<String> unused) {}

    public record CategoryUsage(int resources, int resourcesUsed, long attempts, long successes, double successRate) {}
}
