/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relevo.application.catalog.ResourceCatalog;
import com.relevo.application.health.HealthLedger;
import com.relevo.application.health.ResourceHealth;
import com.relevo.config.AppProperties;
import com.relevo.domain.model.CircuitState;
import com.relevo.domain.model.FetchErrorType;
import com.relevo.domain.model.RemoteResource;
import com.relevo.domain.model.ResourceTier;
import com.relevo.infrastructure.access.AccessException;
import com.relevo.infrastructure.access.AccessResult;
import com.relevo.infrastructure.access.AccessStrategyResolver;
import com.relevo.infrastructure.transport.Deadline;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fetches one logical request for a category by walking its resources tier by tier. Within a tier
 * the best-scoring resource goes first; a lower tier is touched only after every candidate of the
 * tiers above it failed or was skipped.
 */
@Service
public class FallbackOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FallbackOrchestrator.class);

    public static final String MDC_CATEGORY = "category";

    private final ResourceCatalog catalog;
    private final HealthLedger health;
    private final AccessStrategyResolver access;
    private final ResourceRequestFactory requestFactory;
    private final FetchCounters counters;
    private final Executor raceExecutor;
    private final ObjectMapper objectMapper;
    private final AppProperties.Fetch config;

    public FallbackOrchestrator(
            ResourceCatalog catalog,
            HealthLedger health,
            AccessStrategyResolver access,
            ResourceRequestFactory requestFactory,
            FetchCounters counters,
            @Qualifier("fetchRaceExecutor") Executor raceExecutor,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.catalog = catalog;
        this.health = health;
        this.access = access;
        this.requestFactory = requestFactory;
        this.counters = counters;
        this.raceExecutor = raceExecutor;
        this.objectMapper = objectMapper;
        this.config = properties.fetch();
    }

    public FetchResult fetch(String category, RequestSpec spec, int maxAttempts) {
        return fetch(category, spec, maxAttempts, FetchOptions.defaults());
    }

    /**
     * @throws ExhaustedException when no candidate produced a validated success
     */
    public FetchResult fetch(String category, RequestSpec spec, int maxAttempts, FetchOptions options) {
        Objects.requireNonNull(spec, "spec");
        if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        FetchOptions opts = options == null ? FetchOptions.defaults() : options;

        String previousCategory = MDC.get(MDC_CATEGORY);
        MDC.put(MDC_CATEGORY, category);
        try {
            counters.recordRequest();
            return run(category, spec, maxAttempts, opts);
        } finally {
            if (previousCategory == null) MDC.remove(MDC_CATEGORY);
            else MDC.put(MDC_CATEGORY, previousCategory);
        }
    }

    /**
     * Candidates a fetch would try right now, in order, without sending anything.
     */
    public List<PlannedAttempt> plan(String category, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        RequestSpec unkeyed = RequestSpec.get("");
        List<PlannedAttempt> planned = new ArrayList<>();
        for (RemoteResource resource : candidates(category, unkeyed, maxAttempts)) {
            ResourceHealth snapshot = health.snapshot(resource.id());
            planned.add(new PlannedAttempt(
                    resource.id(),
                    resource.name(),
                    resource.tier(),
                    health.priorityScore(resource.id()),
                    snapshot.circuitState(),
                    resource.restricted()
            ));
        }
        return planned;
    }

    private FetchResult run(String category, RequestSpec spec, int maxAttempts, FetchOptions opts) {
        List<RemoteResource> candidates = candidates(category, spec, maxAttempts);
        Deadline deadline = opts.deadline() == null ? Deadline.none() : Deadline.after(opts.deadline());
        Tally tally = new Tally();

        if (candidates.isEmpty()) {
            log.warn("No available resources category={} declared={}", category, catalog.listByCategory(category).size());
        }

        for (Map.Entry<ResourceTier, List<RemoteResource>> group : byTier(candidates).entrySet()) {
            if (deadline.isExpired()) {
                log.warn("Fetch deadline reached before tier={}", group.getKey());
                break;
            }
            List<RemoteResource> ordered = byScore(group.getValue());
            Optional<FetchResult> won = opts.mode() == FetchMode.RACE && ordered.size() > 1
                    ? race(ordered, spec, raceWidth(opts), deadline, tally)
                    : sequential(ordered, spec, deadline, tally);
            if (won.isPresent()) {
                FetchResult result = won.get();
                counters.recordWin(result.tier());
                log.info("Fetch succeeded resource={} tier={} access={} attempts={} latencyMs={}",
                        result.resourceId(), result.tier(), result.accessMethod(), tally.attempted, result.latencyMs());
                return new FetchResult(result.payload(), result.resourceId(), result.tier(), result.accessMethod(),
                        result.status(), result.latencyMs(), tally.attempted);
            }
        }

        counters.recordExhausted();
        log.warn("Category exhausted attempted={} failures={}", tally.attempted, tally.failures);
        throw new ExhaustedException(category, tally.attempted, tally.failures);
    }

    private List<RemoteResource> candidates(String category, RequestSpec spec, int maxAttempts) {
        List<RemoteResource> usable = catalog.listByCategory(category).stream()
                .filter(r -> requestFactory.isConfigured(r, spec))
                .filter(r -> health.isAvailable(r.id()))
                .toList();
        Map<String, Double> scores = scores(usable);
        return usable.stream()
                .sorted(Comparator.comparing(RemoteResource::tier)
                        .thenComparing((RemoteResource r) -> scores.get(r.id()), Comparator.reverseOrder()))
                .limit(maxAttempts)
                .toList();
    }

    private Map<ResourceTier, List<RemoteResource>> byTier(List<RemoteResource> candidates) {
        Map<ResourceTier, List<RemoteResource>> groups = new EnumMap<>(ResourceTier.class);
        for (RemoteResource resource : candidates) {
            groups.computeIfAbsent(resource.tier(), t -> new ArrayList<>()).add(resource);
        }
        return groups;
    }

    // scores move while earlier tiers run, so each tier is re-ranked right before it starts
    private List<RemoteResource> byScore(List<RemoteResource> members) {
        Map<String, Double> scores = scores(members);
        List<RemoteResource> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing((RemoteResource r) -> scores.get(r.id()), Comparator.reverseOrder()));
        return ordered;
    }

    private Map<String, Double> scores(List<RemoteResource> resources) {
        Map<String, Double> scores = new HashMap<>();
        for (RemoteResource resource : resources) {
            scores.put(resource.id(), health.priorityScore(resource.id()));
        }
        return scores;
    }

    private Optional<FetchResult> sequential(List<RemoteResource> ordered, RequestSpec spec, Deadline deadline, Tally tally) {
        for (RemoteResource resource : ordered) {
            if (deadline.isExpired()) return Optional.empty();
            if (!health.isAvailable(resource.id())) {
                log.debug("Skipping resource={} circuit opened during this fetch", resource.id());
                continue;
            }
            Outcome outcome = attempt(resource, spec, deadline);
            record(outcome, tally);
            if (outcome.succeeded()) return Optional.of(outcome.result());
        }
        return Optional.empty();
    }

    private Optional<FetchResult> race(List<RemoteResource> ordered, RequestSpec spec, int width, Deadline deadline, Tally tally) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        for (int from = 0; from < ordered.size(); from += width) {
            if (deadline.isExpired()) return Optional.empty();
            List<RemoteResource> batch = ordered.subList(from, Math.min(from + width, ordered.size())).stream()
                    .filter(r -> health.isAvailable(r.id()))
                    .toList();
            if (batch.isEmpty()) continue;

            CompletionService<Outcome> completion = new ExecutorCompletionService<>(raceExecutor);
            List<Future<Outcome>> futures = new ArrayList<>(batch.size());
            for (RemoteResource resource : batch) {
                futures.add(completion.submit(() -> withMdc(mdc, () -> attempt(resource, spec, deadline))));
            }
            try {
                for (int i = 0; i < futures.size(); i++) {
                    Future<Outcome> done = next(completion, deadline);
                    if (done == null) return Optional.empty();
                    Outcome outcome = done.get();
                    record(outcome, tally);
                    if (outcome.succeeded()) return Optional.of(outcome.result());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Race attempt failed unexpectedly", e.getCause());
            } finally {
                // losers still in flight are abandoned, neither recorded nor counted
                futures.forEach(f -> f.cancel(true));
            }
        }
        return Optional.empty();
    }

    private Future<Outcome> next(CompletionService<Outcome> completion, Deadline deadline) throws InterruptedException {
        if (!deadline.isBounded()) return completion.take();
        if (deadline.isExpired()) return null;
        return completion.poll(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
    }

    // each access step gets the configured attempt timeout, shortened to the fetch deadline
    private Outcome attempt(RemoteResource resource, RequestSpec spec, Deadline deadline) {
        long startedAt = System.nanoTime();
        try {
            TransportRequest request = buildRequest(resource, spec, config.attemptTimeout());
            AccessResult result;
            try {
                result = access.execute(request, resource.restricted(), deadline);
            } catch (AccessException e) {
                throw new ResourceException(resource.id(), e.getType(), e.getMessage(), e);
            }
            validate(resource, spec, result.response());
            long latencyNanos = System.nanoTime() - startedAt;
            return Outcome.success(resource, new FetchResult(
                    result.response().body(),
                    resource.id(),
                    resource.tier(),
                    result.method(),
                    result.response().status(),
                    latencyNanos / 1_000_000,
                    0
            ), latencyNanos);
        } catch (ResourceException e) {
            return Outcome.failure(resource, e, System.nanoTime() - startedAt);
        } catch (RuntimeException e) {
            log.error("Unexpected failure calling resource={}", resource.id(), e);
            ResourceException wrapped = new ResourceException(
                    resource.id(), FetchErrorType.NETWORK_UNREACHABLE, "Unexpected transport failure", e);
            return Outcome.failure(resource, wrapped, System.nanoTime() - startedAt);
        }
    }

    private TransportRequest buildRequest(RemoteResource resource, RequestSpec spec, Duration timeout) {
        try {
            return requestFactory.build(resource, spec, timeout);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // the cause may quote the full URL, so the message stays generic
            throw new ResourceException(resource.id(), FetchErrorType.UPSTREAM_ERROR, "Request could not be built", e);
        }
    }

    private void validate(RemoteResource resource, RequestSpec spec, TransportResponse response) {
        if (response.body().length == 0) {
            throw new ResourceException(resource.id(), FetchErrorType.UPSTREAM_ERROR, "Empty payload");
        }
        if (spec.expectJson()) {
            try {
                objectMapper.readTree(response.body());
            } catch (IOException e) {
                throw new ResourceException(resource.id(), FetchErrorType.UPSTREAM_ERROR, "Malformed JSON payload", e);
            }
        }
    }

    private void record(Outcome outcome, Tally tally) {
        String id = outcome.resource().id();
        tally.attempted++;
        counters.recordAttempt(id, outcome.succeeded());
        if (outcome.succeeded()) {
            health.recordSuccess(id, Duration.ofNanos(outcome.latencyNanos()));
            return;
        }
        ResourceException failure = outcome.failure();
        tally.failures.put(id, failure.getType());
        health.recordFailure(id, failure.getType());
        log.warn("Attempt failed resource={} tier={} type={} message={}",
                id, outcome.resource().tier(), failure.getType(), failure.getSafeMessage());
    }

    private int raceWidth(FetchOptions opts) {
        if (opts.raceWidth() == 0) return config.maxRaceWidth();
        return Math.min(opts.raceWidth(), config.maxRaceWidth());
    }

    private static <T> T withMdc(Map<String, String> context, Supplier<T> body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context == null) MDC.clear();
        else MDC.setContextMap(context);
        try {
            return body.get();
        } finally {
            if (previous == null) MDC.clear();
            else MDC.setContextMap(previous);
        }
    }

    public record PlannedAttempt(
            String resourceId,
            String name,
            ResourceTier tier,
            double priorityScore,
            CircuitState circuitState,
            boolean restricted
    ) {}

    private record Outcome(RemoteResource resource, FetchResult result, ResourceException failure, long latencyNanos) {
        static Outcome success(RemoteResource resource, FetchResult result, long latencyNanos) {
            return new Outcome(resource, result, null, latencyNanos);
        }

        static Outcome failure(RemoteResource resource, ResourceException failure, long latencyNanos) {
            return new Outcome(resource, null, failure, latencyNanos);
        }

        boolean succeeded() {
            return result != null;
        }
    }

    private static final class Tally {
        private int attempted;
        private final Map<String, FetchErrorType> failures = new LinkedHashMap<>();
    }
}
