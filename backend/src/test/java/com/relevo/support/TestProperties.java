/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.support;

import com.relevo.config.AppProperties;

import java.time.Duration;
import java.util.List;

public final class TestProperties {
    private TestProperties() {}

    public static AppProperties.Fetch fetch() {
        return new AppProperties.Fetch(
                Duration.ofMinutes(60),
                Duration.ofMinutes(5),
                3,
                Duration.ofSeconds(2),
                3,
                10,
                0.3
        );
    }

    public static AppProperties.Access access() {
        return new AppProperties.Access(
                new AppProperties.Access.Dns(
                        Duration.ofMinutes(30),
                        Duration.ofSeconds(5),
                        "https://cloudflare-dns.com/dns-query",
                        "https://dns.google/resolve"
                ),
                proxy(20, List.of())
        );
    }

    public static AppProperties.Access.Proxy proxy(int targetSize, List<String> staticProxies) {
        return new AppProperties.Access.Proxy(
                "https://proxies.example/list",
                Duration.ofMinutes(5),
                Duration.ofSeconds(15),
                targetSize,
                10,
                false,
                staticProxies
        );
    }

    public static AppProperties app(List<AppProperties.CatalogEntry> catalog) {
        return new AppProperties(fetch(), access(), catalog);
    }
}
