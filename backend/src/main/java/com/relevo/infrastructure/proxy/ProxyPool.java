/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.proxy;

import com.relevo.config.AppProperties;
import com.relevo.infrastructure.transport.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rotating pool of forward proxies. The active set is an immutable list swapped atomically on
 * refresh; readers never lock, and refreshes are serialized by {@code refreshLock}.
 */
@Component
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);

    private final ProxyListSource source;
    private final Clock clock;
    private final Duration refreshInterval;
    private final Duration listTimeout;
    private final int targetSize;
    private final int maxFailures;
    private final boolean scheduledRefresh;
    private final List<ProxyRecord> operatorProxies;

    private final AtomicReference<PoolState> state;
    private final ReentrantLock refreshLock = new ReentrantLock();

    @Autowired
    public ProxyPool(ProxyListSource source, AppProperties properties, Environment environment, Clock clock) {
        this(source, clock, properties.access().proxy(), operatorProxyList(properties, environment));
    }

    public ProxyPool(ProxyListSource source, Clock clock, AppProperties.Access.Proxy config, List<String> operatorProxies) {
        this.source = source;
        this.clock = clock;
        this.refreshInterval = config.refreshInterval();
        this.listTimeout = config.listTimeout();
        this.targetSize = config.targetSize();
        this.maxFailures = config.maxFailures();
        this.scheduledRefresh = config.scheduledRefresh();
        List<ProxyRecord> fixed = new ArrayList<>();
        for (String raw : operatorProxies) {
            fixed.add(new ProxyRecord(ProxyAddress.parse(raw), true, maxFailures));
        }
        this.operatorProxies = List.copyOf(fixed);
        this.state = new AtomicReference<>(new PoolState(this.operatorProxies, null));
    }

    public Optional<ProxyRecord> best() {
        return best(Deadline.none());
    }

    /**
     * Best active proxy by success rate, then latency. A stale or empty pool is refreshed first, but
     * only within {@code deadline}: a caller never waits on another caller's refresh while the pool
     * still has active proxies, and never past its own deadline otherwise.
     */
    public Optional<ProxyRecord> best(Deadline deadline) {
        PoolState current = state.get();
        if (current.activeCount() == 0 || isStale(current)) {
            refreshWithin(deadline, current.activeCount() > 0);
            current = state.get();
        }
        return current.proxies().stream()
                .filter(ProxyRecord::isActive)
                .sorted(Comparator.comparingDouble(ProxyRecord::successRate).reversed()
                        .thenComparingDouble(p -> p.snapshot().avgLatencyMs()))
                .findFirst();
    }

    public void recordSuccess(ProxyRecord proxy, long latencyMs) {
        proxy.recordSuccess(latencyMs, clock.instant());
    }

    public void recordFailure(ProxyRecord proxy) {
        proxy.recordFailure(clock.instant());
        if (!proxy.isActive()) {
            log.warn("Proxy deactivated address={} after repeated failures", proxy.address());
        }
    }

    /**
     * Replaces the whole listed set. Operator-supplied proxies are always carried over with their counters.
     */
    public void refresh() {
        refreshLock.lock();
        try {
            reload(Deadline.none());
        } finally {
            refreshLock.unlock();
        }
    }

    @Scheduled(
            fixedDelayString = "${app.access.proxy.refresh-interval:PT5M}",
            initialDelayString = "${app.access.proxy.refresh-interval:PT5M}"
    )
    public void scheduledRefresh() {
        if (!scheduledRefresh) return;
        refreshLock.lock();
        try {
            state.set(new PoolState(state.get().proxies(), null));
            reload(Deadline.none());
        } finally {
            refreshLock.unlock();
        }
    }

    private void refreshWithin(Deadline deadline, boolean hasActive) {
        boolean locked;
        try {
            if (hasActive) {
                locked = refreshLock.tryLock();
            } else if (deadline.isBounded()) {
                locked = refreshLock.tryLock(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
            } else {
                refreshLock.lockInterruptibly();
                locked = true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!locked) {
            log.debug("Proxy refresh already running, using the current pool");
            return;
        }
        try {
            reload(deadline);
        } finally {
            refreshLock.unlock();
        }
    }

    // caller holds refreshLock
    private void reload(Deadline deadline) {
        PoolState current = state.get();
        if (current.refreshedAt() != null && current.activeCount() > 0 && !isStale(current)) {
            return;
        }
        if (deadline.isExpired()) return;
        List<ProxyAddress> listed = new ArrayList<>(source.fetch(deadline.cap(listTimeout)));
        Collections.shuffle(listed);
        Set<ProxyAddress> seen = new LinkedHashSet<>();
        for (ProxyRecord p : operatorProxies) seen.add(p.address());

        List<ProxyRecord> next = new ArrayList<>(operatorProxies);
        for (ProxyAddress address : listed) {
            if (next.size() - operatorProxies.size() >= targetSize) break;
            if (seen.add(address)) {
                next.add(new ProxyRecord(address, false, maxFailures));
            }
        }
        state.set(new PoolState(List.copyOf(next), clock.instant()));
        log.info("Proxy pool refreshed listed={} pooled={} operator={}",
                listed.size(), next.size() - operatorProxies.size(), operatorProxies.size());
    }

    public List<ProxyRecord.ProxySnapshot> snapshot() {
        return state.get().proxies().stream().map(ProxyRecord::snapshot).toList();
    }

    List<ProxyRecord> proxies() {
        return state.get().proxies();
    }

    public Optional<Instant> lastRefreshedAt() {
        return Optional.ofNullable(state.get().refreshedAt());
    }

    private boolean isStale(PoolState current) {
        return current.refreshedAt() == null
                || !clock.instant().isBefore(current.refreshedAt().plus(refreshInterval));
    }

    private static List<String> operatorProxyList(AppProperties properties, Environment environment) {
        List<String> out = new ArrayList<>(properties.access().proxy().staticProxies());
        String fromEnv = environment.getProperty("PROXY_URL");
        if (fromEnv != null && !fromEnv.isBlank() && !out.contains(fromEnv.trim())) {
            out.add(fromEnv.trim());
        }
        return out;
    }

    private record PoolState(List<ProxyRecord> proxies, Instant refreshedAt) {
        long activeCount() {
            return proxies.stream().filter(ProxyRecord::isActive).count();
        }
    }
}
