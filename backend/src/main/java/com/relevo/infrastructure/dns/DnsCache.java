/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.dns;

import com.relevo.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hostname to A-record cache. Entries are immutable and replaced whole, so readers never see
 * a partially updated answer.
 */
@Component
public class DnsCache {
    private final Map<String, DnsCacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public DnsCache(AppProperties properties, Clock clock) {
        this(properties.access().dns().cacheTtl(), clock);
    }

    public DnsCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<DnsCacheEntry> lookup(String hostname) {
        DnsCacheEntry entry = entries.get(key(hostname));
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            entries.remove(key(hostname), entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public Optional<DnsCacheEntry> lookup(String hostname, DohProvider provider) {
        return lookup(hostname).filter(e -> e.provider() == provider);
    }

    public DnsCacheEntry put(String hostname, List<String> ips, DohProvider provider) {
        DnsCacheEntry entry = new DnsCacheEntry(key(hostname), ips, clock.instant(), ttl, provider);
        entries.put(key(hostname), entry);
        return entry;
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        return before - entries.size();
    }

    public List<DnsCacheEntry> entries() {
        Instant now = clock.instant();
        return entries.values().stream()
                .filter(e -> !e.isExpired(now))
                .sorted(Comparator.comparing(DnsCacheEntry::hostname))
                .toList();
    }

    private static String key(String hostname) {
        return hostname.toLowerCase();
    }
}
