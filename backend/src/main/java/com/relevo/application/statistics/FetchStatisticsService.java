/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.statistics;

import com.relevo.application.catalog.ResourceCatalog;
import com.relevo.application.health.HealthLedger;
import com.relevo.application.health.ResourceHealth;
import com.relevo.application.orchestration.FetchCounters;
import com.relevo.domain.model.CircuitState;
import com.relevo.domain.model.FetchErrorType;
import com.relevo.domain.model.RemoteResource;
import com.relevo.infrastructure.access.AccessStatistics;
import com.relevo.infrastructure.dns.DnsCache;
import com.relevo.infrastructure.proxy.ProxyPool;
import com.relevo.infrastructure.proxy.ProxyRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

@Service
public class FetchStatisticsService {
    static final double HEALTHY_THRESHOLD = 0.8;
    static final int TOP_LIMIT = 10;

    private final ResourceCatalog catalog;
    private final FetchCounters counters;
    private final HealthLedger health;
    private final AccessStatistics accessStatistics;
    private final ProxyPool proxyPool;
    private final DnsCache dnsCache;

    public FetchStatisticsService(
            ResourceCatalog catalog,
            FetchCounters counters,
            HealthLedger health,
            AccessStatistics accessStatistics,
            ProxyPool proxyPool,
            DnsCache dnsCache
    ) {
        this.catalog = catalog;
        this.counters = counters;
        this.health = health;
        this.accessStatistics = accessStatistics;
        this.proxyPool = proxyPool;
        this.dnsCache = dnsCache;
    }

    public StatisticsReport report() {
        FetchCounters.Snapshot snapshot = counters.snapshot();

        List<StatisticsReport.ResourceUsage> usages = new ArrayList<>();
        for (RemoteResource resource : catalog.all()) {
            long attempts = snapshot.attemptsByResource().getOrDefault(resource.id(), 0L);
            long successes = snapshot.successesByResource().getOrDefault(resource.id(), 0L);
            usages.add(new StatisticsReport.ResourceUsage(
                    resource.id(),
                    resource.category(),
                    resource.tier(),
                    attempts,
                    successes,
                    attempts - successes,
                    rate(successes, attempts),
                    round(health.snapshot(resource.id()).avgLatencyMs()),
                    classify(attempts, successes)
            ));
        }
        usages.sort(Comparator.comparing(StatisticsReport.ResourceUsage::id));

        int used = (int) usages.stream().filter(u -> u.attempts() > 0).count();
        int successful = (int) usages.stream().filter(u -> u.successes() > 0).count();

        return new StatisticsReport(
                new StatisticsReport.Overview(
                        snapshot.totalRequests(),
                        snapshot.successfulRequests(),
                        snapshot.exhaustedRequests(),
                        rate(snapshot.successfulRequests(), snapshot.totalRequests())
                ),
                new StatisticsReport.Utilization(usages.size(), used, successful, rate(used, usages.size())),
                snapshot.winsByTier(),
                List.copyOf(usages),
                breakdown(usages),
                top(usages, Comparator.comparing(StatisticsReport.ResourceUsage::successRate).reversed()
                        .thenComparing(Comparator.comparing(StatisticsReport.ResourceUsage::successes).reversed()),
                        u -> u.successes() > 0),
                top(usages, Comparator.comparing(StatisticsReport.ResourceUsage::attempts).reversed(), u -> u.attempts() > 0),
                worst(usages),
                byCategory(usages),
                accessStatistics.snapshot()
        );
    }

    public List<CategoryAvailability> categoryAvailability() {
        List<CategoryAvailability> out = new ArrayList<>();
        for (String category : new TreeSet<>(catalog.categories())) {
            List<RemoteResource> members = catalog.listByCategory(category);
            int available = 0;
            int open = 0;
            int rateLimited = 0;
            long attempts = 0;
            long successes = 0;
            for (RemoteResource resource : members) {
                ResourceHealth h = health.snapshot(resource.id());
                if (h.circuitState() == CircuitState.OPEN) {
                    open++;
                    if (h.lastErrorType() == FetchErrorType.RATE_LIMITED) rateLimited++;
                } else {
                    available++;
                }
                attempts += h.attempts();
                successes += h.successCount();
            }
            out.add(new CategoryAvailability(category, members.size(), available, open, rateLimited, rate(successes, attempts)));
        }
        return out;
    }

    public AccessReport accessReport() {
        List<ProxyRecord.ProxySnapshot> proxies = proxyPool.snapshot();
        int active = (int) proxies.stream().filter(ProxyRecord.ProxySnapshot::active).count();
        return new AccessReport(
                accessStatistics.snapshot(),
                active,
                proxies.size(),
                proxyPool.lastRefreshedAt().orElse(null),
                proxies,
                dnsCache.entries()
        );
    }

    static StatisticsReport.UsageClass classify(long attempts, long successes) {
        if (attempts == 0) return StatisticsReport.UsageClass.UNUSED;
        if (successes == 0) return StatisticsReport.UsageClass.FAILED;
        if ((double) successes / (double) attempts >= HEALTHY_THRESHOLD) return StatisticsReport.UsageClass.HEALTHY;
        return StatisticsReport.UsageClass.DEGRADED;
    }

    private static StatisticsReport.HealthBreakdown breakdown(List<StatisticsReport.ResourceUsage> usages) {
        Map<StatisticsReport.UsageClass, List<String>> groups = new LinkedHashMap<>();
        for (StatisticsReport.UsageClass c : StatisticsReport.UsageClass.values()) groups.put(c, new ArrayList<>());
        for (StatisticsReport.ResourceUsage usage : usages) groups.get(usage.classification()).add(usage.id());
        return new StatisticsReport.HealthBreakdown(
                List.copyOf(groups.get(StatisticsReport.UsageClass.HEALTHY)),
                List.copyOf(groups.get(StatisticsReport.UsageClass.DEGRADED)),
                List.copyOf(groups.get(StatisticsReport.UsageClass.FAILED)),
                List.copyOf(groups.get(StatisticsReport.UsageClass.UNUSED))
        );
    }

    private static List<StatisticsReport.ResourceUsage> top(
            List<StatisticsReport.ResourceUsage> usages,
            Comparator<StatisticsReport.ResourceUsage> order,
            Predicate<StatisticsReport.ResourceUsage> eligible
    ) {
        return usages.stream()
                .filter(eligible)
                .sorted(order.thenComparing(StatisticsReport.ResourceUsage::id))
                .limit(TOP_LIMIT)
                .toList();
    }

    private static List<StatisticsReport.ResourceUsage> worst(List<StatisticsReport.ResourceUsage> usages) {
        return usages.stream()
                .filter(u -> u.failures() > 0)
                .sorted(Comparator.comparing(StatisticsReport.ResourceUsage::failures).reversed()
                        .thenComparing(StatisticsReport.ResourceUsage::successRate)
                        .thenComparing(StatisticsReport.ResourceUsage::id))
                .limit(TOP_LIMIT)
                .toList();
    }

    private static Map<String, StatisticsReport.CategoryUsage> byCategory(List<StatisticsReport.ResourceUsage> usages) {
        Map<String, List<StatisticsReport.ResourceUsage>> grouped = new TreeMap<>();
        for (StatisticsReport.ResourceUsage usage : usages) {
            grouped.computeIfAbsent(usage.category(), c -> new ArrayList<>()).add(usage);
        }
        Map<String, StatisticsReport.CategoryUsage> out = new LinkedHashMap<>();
        grouped.forEach((category, members) -> {
            long attempts = members.stream().mapToLong(StatisticsReport.ResourceUsage::attempts).sum();
            long successes = members.stream().mapToLong(StatisticsReport.ResourceUsage::successes).sum();
            int used = (int) members.stream().filter(u -> u.attempts() > 0).count();
            out.put(category, new StatisticsReport.CategoryUsage(members.size(), used, attempts, successes, rate(successes, attempts)));
        });
        return out;
    }

    private static double rate(long part, long whole) {
        if (whole == 0) return 0.0;
        return round((double) part / (double) whole);
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
