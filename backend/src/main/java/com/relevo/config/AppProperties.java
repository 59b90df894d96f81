/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @Valid @DefaultValue Fetch fetch,
        @Valid @DefaultValue Access access,
        @Valid List<CatalogEntry> catalog
) {
    public AppProperties {
        if (catalog == null) catalog = List.of();
    }

    public record Fetch(
            @DefaultValue("PT60M") Duration rateLimitCooldown,
            @DefaultValue("PT5M") Duration fixedCooldown,
            @DefaultValue("3") @Min(1) int failureThreshold,
            @DefaultValue("PT10S") Duration attemptTimeout,
            @DefaultValue("3") @Min(1) int maxRaceWidth,
            @DefaultValue("10") @Min(1) int defaultMaxAttempts,
            @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("1.0") double latencySmoothing
    ) {}

    public record Access(
            @Valid @DefaultValue Dns dns,
            @Valid @DefaultValue Proxy proxy
    ) {
        public record Dns(
                @DefaultValue("PT30M") Duration cacheTtl,
                @DefaultValue("PT5S") Duration lookupTimeout,
                @DefaultValue("https://cloudflare-dns.com/dns-query") String cloudflareUrl,
                @DefaultValue("https://dns.google/resolve") String googleUrl
        ) {}

        public record Proxy(
                @DefaultValue("https://api.proxyscrape.com/v2/?request=displayproxies&protocol=http&timeout=10000&country=all&ssl=all&anonymity=elite")
                String listUrl,
                @DefaultValue("PT5M") Duration refreshInterval,
                @DefaultValue("PT15S") Duration listTimeout,
                @DefaultValue("20") @Min(1) int targetSize,
                @DefaultValue("10") @Min(1) int maxFailures,
                @DefaultValue("true") boolean scheduledRefresh,
                List<String> staticProxies
        ) {
            public Proxy {
                if (staticProxies == null) staticProxies = List.of();
            }
        }
    }

    public record CatalogEntry(
            @NotBlank String id,
            String name,
            @NotBlank String category,
            @NotBlank String baseEndpoint,
            @NotNull String tier,
            @Valid Auth auth,
            String rateLimit,
            boolean restricted
    ) {}

    public record Auth(
            @DefaultValue("NONE") String type,
            String name,
            String env
    ) {}
}
