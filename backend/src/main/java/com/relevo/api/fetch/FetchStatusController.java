/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.api.fetch;

import com.relevo.application.catalog.ResourceCatalog;
import com.relevo.application.catalog.SecretResolver;
import com.relevo.application.health.HealthLedger;
import com.relevo.application.health.ResourceHealth;
import com.relevo.application.orchestration.FallbackOrchestrator;
import com.relevo.application.statistics.AccessReport;
import com.relevo.application.statistics.CategoryAvailability;
import com.relevo.application.statistics.FetchStatisticsService;
import com.relevo.application.statistics.StatisticsReport;
import com.relevo.config.AppProperties;
import com.relevo.infrastructure.proxy.ProxyPool;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/fetch")
public class FetchStatusController {
    private final FetchStatisticsService statistics;
    private final HealthLedger health;
    private final ResourceCatalog catalog;
    private final SecretResolver secretResolver;
    private final FallbackOrchestrator orchestrator;
    private final ProxyPool proxyPool;
    private final AppProperties properties;

    public FetchStatusController(
            FetchStatisticsService statistics,
            HealthLedger health,
            ResourceCatalog catalog,
            SecretResolver secretResolver,
            FallbackOrchestrator orchestrator,
            ProxyPool proxyPool,
            AppProperties properties
    ) {
        this.statistics = statistics;
        this.health = health;
        this.catalog = catalog;
        this.secretResolver = secretResolver;
        this.orchestrator = orchestrator;
        this.proxyPool = proxyPool;
        this.properties = properties;
    }

    @GetMapping("/stats")
    public StatisticsReport stats() {
        return statistics.report();
    }

    @GetMapping("/health")
    public List<ResourceHealth> health() {
        return catalog.all().stream().map(r -> health.snapshot(r.id())).toList();
    }

    @GetMapping("/categories")
    public List<CategoryAvailability> categories() {
        return statistics.categoryAvailability();
    }

    @GetMapping("/access")
    public AccessReport access() {
        return statistics.accessReport();
    }

    @PostMapping("/access/proxies/refresh")
    public AccessReport refreshProxies() {
        proxyPool.refresh();
        return statistics.accessReport();
    }

    @GetMapping("/plan/{category}")
    public List<FallbackOrchestrator.PlannedAttempt> plan(
            @PathVariable String category,
            @RequestParam(name = "maxAttempts", required = false) Integer maxAttempts
    ) {
        int attempts = maxAttempts == null ? properties.fetch().defaultMaxAttempts() : maxAttempts;
        return orchestrator.plan(category, attempts);
    }

    /**
     * Which secrets the catalog references and whether each is set. Values are never returned.
     */
    @GetMapping("/secrets")
    public Map<String, Boolean> secrets() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String name : catalog.requiredSecrets()) {
            out.put(name, secretResolver.resolve(name).isPresent());
        }
        return out;
    }
}
