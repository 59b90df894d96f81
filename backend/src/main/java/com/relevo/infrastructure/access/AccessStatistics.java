/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.access;

import com.relevo.domain.model.AccessMethod;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

@Component
public class AccessStatistics {
    private final Map<AccessMethod, LongAdder> successes = new EnumMap<>(AccessMethod.class);
    private final Map<AccessMethod, LongAdder> failures = new EnumMap<>(AccessMethod.class);

    public AccessStatistics() {
        for (AccessMethod method : AccessMethod.values()) {
            successes.put(method, new LongAdder());
            failures.put(method, new LongAdder());
        }
    }

    void recordSuccess(AccessMethod method) {
        successes.get(method).increment();
    }

    void recordFailure(AccessMethod method) {
        failures.get(method).increment();
    }

    public Map<AccessMethod, MethodCounts> snapshot() {
        Map<AccessMethod, MethodCounts> out = new LinkedHashMap<>();
        for (AccessMethod method : AccessMethod.values()) {
            long ok = successes.get(method).sum();
            long failed = failures.get(method).sum();
            long total = ok + failed;
            out.put(method, new MethodCounts(ok, failed, total == 0 ? 0 : (double) ok / (double) total));
        }
        return out;
    }

    public record MethodCounts(long success, long failed, double successRate) {}
}
