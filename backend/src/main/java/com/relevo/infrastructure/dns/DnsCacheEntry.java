/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.dns;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public record DnsCacheEntry(
        String hostname,
        List<String> ips,
        Instant resolvedAt,
        Duration ttl,
        DohProvider provider
) {
    public DnsCacheEntry {
        if (ips == null || ips.isEmpty()) throw new IllegalArgumentException("DNS entry needs at least one address");
        ips = List.copyOf(ips);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(resolvedAt.plus(ttl));
    }

    /**
     * Spreads load across all A records of the answer.
     */
    public String pickAddress() {
        if (ips.size() == 1) return ips.get(0);
        return ips.get(ThreadLocalRandom.current().nextInt(ips.size()));
    }
}
