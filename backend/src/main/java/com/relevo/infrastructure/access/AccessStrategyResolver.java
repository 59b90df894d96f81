/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.access;

import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.FetchErrorType;
import com.relevo.infrastructure.dns.DohProvider;
import com.relevo.infrastructure.dns.DohResolver;
import com.relevo.infrastructure.proxy.ProxyPool;
import com.relevo.infrastructure.proxy.ProxyRecord;
import com.relevo.infrastructure.transport.Deadline;
import com.relevo.infrastructure.transport.HttpTransport;
import com.relevo.infrastructure.transport.TransportException;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Performs one outbound call. Unrestricted resources get a single direct attempt; restricted ones
 * walk {@link AccessMethod} in declaration order until one step returns a 2xx. Each step gets the
 * request timeout for itself, DNS and proxy lookups included, shortened to the caller's deadline.
 */
@Component
public class AccessStrategyResolver {
    private static final Logger log = LoggerFactory.getLogger(AccessStrategyResolver.class);
    // narrower than any "rate" substring, which also matches unrelated words such as "separate"
    private static final Pattern RATE_LIMIT_TEXT = Pattern.compile("rate[ _-]?limit", Pattern.CASE_INSENSITIVE);

    private final HttpTransport transport;
    private final DohResolver dohResolver;
    private final ProxyPool proxyPool;
    private final AccessStatistics statistics;

    public AccessStrategyResolver(
            HttpTransport transport,
            DohResolver dohResolver,
            ProxyPool proxyPool,
            AccessStatistics statistics
    ) {
        this.transport = transport;
        this.dohResolver = dohResolver;
        this.proxyPool = proxyPool;
        this.statistics = statistics;
    }

    public AccessResult execute(TransportRequest request, boolean restricted) {
        return execute(request, restricted, Deadline.none());
    }

    /**
     * @param deadline caller's overall bound; no step starts after it and none runs past it
     */
    public AccessResult execute(TransportRequest request, boolean restricted, Deadline deadline) {
        long startedAt = System.nanoTime();
        List<AccessMethod> ladder = restricted ? List.of(AccessMethod.values()) : List.of(AccessMethod.DIRECT);
        List<AccessMethod> trail = new ArrayList<>();

        StepFailure last = null;
        for (AccessMethod method : ladder) {
            if (deadline.isExpired()) {
                last = new StepFailure(FetchErrorType.TIMEOUT, "fetch deadline reached before " + method, null, null);
                break;
            }
            trail.add(method);
            Deadline step = deadline.within(request.timeout());
            StepOutcome outcome = attempt(method, request, step);
            if (outcome.response() != null) {
                statistics.recordSuccess(method);
                long latencyMs = (System.nanoTime() - startedAt) / 1_000_000;
                if (method != AccessMethod.DIRECT) {
                    log.info("Access succeeded via {} host={} steps={}", method, request.uri().getHost(), trail.size());
                }
                return new AccessResult(outcome.response(), method, trail, latencyMs);
            }
            statistics.recordFailure(method);
            last = outcome.failure();
            log.debug("Access step {} failed host={} type={} status={}",
                    method, request.uri().getHost(), last.type(), last.status());
            if (last.type() == FetchErrorType.RATE_LIMITED) {
                // another route to the same provider is still rate limited
                break;
            }
        }

        if (last == null) {
            last = new StepFailure(FetchErrorType.NETWORK_UNREACHABLE, "no access method attempted", null, null);
        }
        throw new AccessException(last.type(), last.message(), trail, last.status(), last.cause());
    }

    private StepOutcome attempt(AccessMethod method, TransportRequest request, Deadline step) {
        return switch (method) {
            case DIRECT -> send(request, null, step);
            case DNS_CLOUDFLARE -> viaDns(request, DohProvider.CLOUDFLARE, step);
            case DNS_GOOGLE -> viaDns(request, DohProvider.GOOGLE, step);
            case PROXY -> viaProxy(request, false, step);
            case DNS_PROXY -> viaProxy(request, true, step);
        };
    }

    private StepOutcome viaDns(TransportRequest request, DohProvider provider, Deadline step) {
        String host = request.uri().getHost();
        Optional<String> ip = dohResolver.resolve(host, provider, step);
        if (ip.isEmpty()) {
            return StepOutcome.failed(new StepFailure(FetchErrorType.NETWORK_UNREACHABLE,
                    provider + " returned no answer for " + host, null, null));
        }
        return send(request.pinnedTo(ip.get()), null, step);
    }

    private StepOutcome viaProxy(TransportRequest request, boolean pinDns, Deadline step) {
        TransportRequest target = request;
        if (pinDns) {
            String host = request.uri().getHost();
            Optional<DohResolver.ResolvedAddress> resolved = dohResolver.resolveAny(host, step);
            if (resolved.isEmpty()) {
                return StepOutcome.failed(new StepFailure(FetchErrorType.NETWORK_UNREACHABLE,
                        "no DoH answer for " + host, null, null));
            }
            target = request.pinnedTo(resolved.get().ip());
        }
        Optional<ProxyRecord> proxy = proxyPool.best(step);
        if (proxy.isEmpty()) {
            return StepOutcome.failed(new StepFailure(FetchErrorType.NETWORK_UNREACHABLE,
                    "no active proxy available", null, null));
        }
        return send(target.viaProxy(proxy.get().address()), proxy.get(), step);
    }

    private StepOutcome send(TransportRequest request, ProxyRecord proxy, Deadline step) {
        if (step.isExpired()) {
            return StepOutcome.failed(new StepFailure(FetchErrorType.TIMEOUT,
                    "step budget spent before calling " + request.loggableUri(), null, null));
        }
        long startedAt = System.nanoTime();
        try {
            TransportResponse response = transport.send(request.withTimeout(step.cap(request.timeout())));
            if (response.isSuccess()) {
                if (proxy != null) proxyPool.recordSuccess(proxy, (System.nanoTime() - startedAt) / 1_000_000);
                return StepOutcome.succeeded(response);
            }
            // the proxy itself delivered an answer, so its health is fine
            if (proxy != null) proxyPool.recordSuccess(proxy, (System.nanoTime() - startedAt) / 1_000_000);
            FetchErrorType type = isRateLimited(response) ? FetchErrorType.RATE_LIMITED : FetchErrorType.UPSTREAM_ERROR;
            return StepOutcome.failed(new StepFailure(type,
                    "HTTP " + response.status() + " from " + request.loggableUri(), response.status(), null));
        } catch (TransportException e) {
            if (proxy != null) proxyPool.recordFailure(proxy);
            return StepOutcome.failed(new StepFailure(e.getType(), e.getMessage(), null, e));
        }
    }

    /**
     * 429, or any error body that says it was rate limited.
     */
    static boolean isRateLimited(TransportResponse response) {
        if (response.isRateLimited()) return true;
        return response.status() >= 400 && RATE_LIMIT_TEXT.matcher(response.bodyAsString()).find();
    }

    private record StepFailure(FetchErrorType type, String message, Integer status, Throwable cause) {}

    private record StepOutcome(TransportResponse response, StepFailure failure) {
        static StepOutcome succeeded(TransportResponse response) {
            return new StepOutcome(response, null);
        }

        static StepOutcome failed(StepFailure failure) {
            return new StepOutcome(null, failure);
        }
    }
}
