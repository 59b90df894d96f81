/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.statistics;

import com.relevo.domain.model.AccessMethod;
import com.relevo.infrastructure.access.AccessStatistics;
import com.relevo.infrastructure.dns.DnsCacheEntry;
import com.relevo.infrastructure.proxy.ProxyRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AccessReport(
        Map<AccessMethod, AccessStatistics.MethodCounts> methods,
        int proxiesActive,
        int proxiesTotal,
        Instant proxiesRefreshedAt,
        List<ProxyRecord.ProxySnapshot> proxies,
        List<DnsCacheEntry> dnsCache
) {}
