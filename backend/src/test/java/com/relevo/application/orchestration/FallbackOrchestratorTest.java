/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relevo.application.catalog.InMemoryResourceCatalog;
import com.relevo.application.health.ResourceHealth;
import com.relevo.application.health.ResourceHealthService;
import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.CircuitState;
import com.relevo.domain.model.FetchErrorType;
import com.relevo.domain.model.RemoteResource;
import com.relevo.domain.model.ResourceAuth;
import com.relevo.domain.model.ResourceTier;
import com.relevo.infrastructure.access.AccessException;
import com.relevo.infrastructure.access.AccessResult;
import com.relevo.infrastructure.access.AccessStrategyResolver;
import com.relevo.infrastructure.transport.Deadline;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import com.relevo.support.MutableClock;
import com.relevo.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class FallbackOrchestratorTest {
    @Mock
    private AccessStrategyResolver access;

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<Deadline> deadlines = Collections.synchronizedList(new ArrayList<>());

    private ResourceHealthService health;
    private FetchCounters counters;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        health = new ResourceHealthService(TestProperties.app(List.of()), clock);
        counters = new FetchCounters();
        executor = Executors.newFixedThreadPool(4);
        lenient().when(access.execute(any(), anyBoolean(), any())).thenAnswer(invocation -> {
            TransportRequest request = invocation.getArgument(0);
            String id = request.uri().getHost().split("\\.")[0];
            calls.add(id);
            deadlines.add(invocation.getArgument(2));
            Behavior behavior = behaviors.getOrDefault(id, Behavior.fail(FetchErrorType.NETWORK_UNREACHABLE));
            return behavior.apply(id);
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void lowerTierOnlyAfterEveryHigherTierMemberFails() {
        behaviors.put("c1", Behavior.fail(FetchErrorType.TIMEOUT));
        behaviors.put("c2", Behavior.fail(FetchErrorType.UPSTREAM_ERROR));
        behaviors.put("h1", Behavior.ok("{\"price\":1}"));
        behaviors.put("l1", Behavior.ok("{\"price\":2}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("l1", ResourceTier.LOW),
                resource("h1", ResourceTier.HIGH),
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get("price"), 10);

        assertEquals("h1", result.resourceId());
        assertEquals(ResourceTier.HIGH, result.tier());
        assertEquals(3, result.attempts());
        assertEquals("{\"price\":1}", result.bodyAsString());
        assertEquals(List.of("c1", "c2", "h1"), calls);
        assertEquals(1L, counters.snapshot().winsByTier().get(ResourceTier.HIGH));
    }

    @Test
    void exhaustionAttemptsExactlyTheCappedCandidateCount() {
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH),
                resource("h2", ResourceTier.HIGH),
                resource("m1", ResourceTier.MEDIUM),
                resource("e1", ResourceTier.EMERGENCY)
        );

        ExhaustedException capped = assertThrows(ExhaustedException.class,
                () -> orchestrator.fetch("market_data", RequestSpec.get(""), 3));
        assertEquals(3, capped.getAttempted());
        assertEquals(List.of("c1", "h1", "h2"), List.copyOf(capped.getFailures().keySet()));

        calls.clear();
        clock.advance(Duration.ofHours(2));
        ExhaustedException all = assertThrows(ExhaustedException.class,
                () -> orchestrator.fetch("market_data", RequestSpec.get(""), 10));
        assertEquals(5, all.getAttempted());
        assertEquals(5, calls.size());
        assertEquals(2, counters.snapshot().exhaustedRequests());
    }

    @Test
    void rateLimitedCriticalsCoolDownAndHighTierServes() {
        behaviors.put("c1", Behavior.fail(FetchErrorType.RATE_LIMITED));
        behaviors.put("c2", Behavior.fail(FetchErrorType.RATE_LIMITED));
        behaviors.put("h1", Behavior.ok("[1,2,3]"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );

        FetchResult first = orchestrator.fetch("market_data", RequestSpec.get("ticker"), 10);

        assertEquals("h1", first.resourceId());
        for (String id : List.of("c1", "c2")) {
            ResourceHealth snapshot = health.snapshot(id);
            assertEquals(CircuitState.OPEN, snapshot.circuitState());
            assertFalse(Duration.between(clock.instant(), snapshot.cooldownUntil()).compareTo(Duration.ofMinutes(60)) < 0);
        }

        calls.clear();
        clock.advance(Duration.ofMinutes(30));
        FetchResult second = orchestrator.fetch("market_data", RequestSpec.get("ticker"), 10);

        assertEquals("h1", second.resourceId());
        assertEquals(List.of("h1"), calls);
        assertEquals(1, second.attempts());
    }

    @Test
    void betterScoringMemberOfATierGoesFirst() {
        health.recordSuccess("c2", Duration.ofMillis(50));
        behaviors.put("c1", Behavior.ok("{}"));
        behaviors.put("c2", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get(""), 10);

        assertEquals("c2", result.resourceId());
        assertEquals(List.of("c2"), calls);
    }

    @Test
    void openCircuitIsNeverAttempted() {
        for (int i = 0; i < 3; i++) health.recordFailure("c1", FetchErrorType.TIMEOUT);
        behaviors.put("c1", Behavior.ok("{}"));
        behaviors.put("h1", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get(""), 10);

        assertEquals("h1", result.resourceId());
        assertFalse(calls.contains("c1"));
    }

    @Test
    void malformedJsonFallsThroughToNextResource() {
        behaviors.put("c1", Behavior.ok("<html>maintenance</html>"));
        behaviors.put("c2", Behavior.ok("{\"ok\":true}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get("").expectingJson(), 10);

        assertEquals("c2", result.resourceId());
        assertEquals(FetchErrorType.UPSTREAM_ERROR, health.snapshot("c1").lastErrorType());
    }

    @Test
    void resourceWithoutSecretIsExcluded() {
        behaviors.put("k1", Behavior.ok("{}"));
        behaviors.put("h1", Behavior.ok("{}"));
        RemoteResource keyed = new RemoteResource("k1", null, "market_data", "https://k1.example", ResourceTier.CRITICAL,
                new ResourceAuth.QueryKey("apiKey", "MISSING_KEY"), null, false);
        FallbackOrchestrator orchestrator = orchestrator(keyed, resource("h1", ResourceTier.HIGH));

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get(""), 10);

        assertEquals("h1", result.resourceId());
        assertEquals(List.of("h1"), calls);
    }

    @Test
    void unknownCategoryIsExhaustedWithoutAttempts() {
        FallbackOrchestrator orchestrator = orchestrator(resource("c1", ResourceTier.CRITICAL));

        ExhaustedException ex = assertThrows(ExhaustedException.class,
                () -> orchestrator.fetch("weather", RequestSpec.get(""), 5));

        assertEquals(0, ex.getAttempted());
        assertTrue(calls.isEmpty());
    }

    @Test
    void rejectsNonPositiveAttemptBudget() {
        FallbackOrchestrator orchestrator = orchestrator(resource("c1", ResourceTier.CRITICAL));

        assertThrows(IllegalArgumentException.class, () -> orchestrator.fetch("market_data", RequestSpec.get(""), 0));
    }

    @Test
    void raceReturnsFastestSuccessOfTheTier() {
        behaviors.put("c1", Behavior.slow(Duration.ofMillis(1500), "{\"from\":\"c1\"}"));
        behaviors.put("c2", Behavior.fail(FetchErrorType.UPSTREAM_ERROR));
        behaviors.put("c3", Behavior.ok("{\"from\":\"c3\"}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL),
                resource("c3", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get(""), 10, FetchOptions.race(3));

        assertEquals("c3", result.resourceId());
        assertFalse(calls.contains("h1"));
        // the slow loser is cancelled and leaves no trace
        assertEquals(0, health.snapshot("c1").attempts());
        assertTrue(result.attempts() <= 2);
    }

    @Test
    void raceFallsToNextTierWhenWholeTierFails() {
        behaviors.put("h1", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );

        FetchResult result = orchestrator.fetch("market_data", RequestSpec.get(""), 10, FetchOptions.race(0));

        assertEquals("h1", result.resourceId());
        assertEquals(3, result.attempts());
    }

    @Test
    void fetchDeadlineStopsFurtherAttempts() {
        behaviors.put("c1", Behavior.slowFailure(Duration.ofMillis(400), FetchErrorType.TIMEOUT));
        behaviors.put("c2", Behavior.ok("{}"));
        behaviors.put("h1", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );
        FetchOptions options = FetchOptions.defaults().withDeadline(Duration.ofMillis(300));

        ExhaustedException ex = assertThrows(ExhaustedException.class,
                () -> orchestrator.fetch("market_data", RequestSpec.get(""), 10, options));

        assertEquals(1, ex.getAttempted());
        assertEquals(List.of("c1"), calls);
        assertTrue(deadlines.get(0).isBounded());
    }

    @Test
    void withoutDeadlineAttemptsRunUnbounded() {
        behaviors.put("c1", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(resource("c1", ResourceTier.CRITICAL));

        orchestrator.fetch("market_data", RequestSpec.get(""), 10);

        assertFalse(deadlines.get(0).isBounded());
    }

    @Test
    void raceModeHonoursTheDeadline() {
        behaviors.put("c1", Behavior.slow(Duration.ofMillis(1500), "{}"));
        behaviors.put("c2", Behavior.slow(Duration.ofMillis(1500), "{}"));
        behaviors.put("h1", Behavior.ok("{}"));
        FallbackOrchestrator orchestrator = orchestrator(
                resource("c1", ResourceTier.CRITICAL),
                resource("c2", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH)
        );
        FetchOptions options = FetchOptions.race(2).withDeadline(Duration.ofMillis(200));

        long startedAt = System.nanoTime();
        ExhaustedException ex = assertThrows(ExhaustedException.class,
                () -> orchestrator.fetch("market_data", RequestSpec.get(""), 10, options));

        assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofMillis(1200)) < 0);
        assertEquals(0, ex.getAttempted());
        assertFalse(calls.contains("h1"));
    }

    @Test
    void planListsCandidatesInAttemptOrder() {
        for (int i = 0; i < 3; i++) health.recordFailure("c1", FetchErrorType.TIMEOUT);
        FallbackOrchestrator orchestrator = orchestrator(
                resource("m1", ResourceTier.MEDIUM),
                resource("c1", ResourceTier.CRITICAL),
                resource("h1", ResourceTier.HIGH),
                resource("c2", ResourceTier.CRITICAL)
        );

        List<String> planned = orchestrator.plan("market_data", 2).stream()
                .map(FallbackOrchestrator.PlannedAttempt::resourceId)
                .toList();

        assertEquals(List.of("c2", "h1"), planned);
        assertTrue(calls.isEmpty());
    }

    private FallbackOrchestrator orchestrator(RemoteResource... resources) {
        return new FallbackOrchestrator(
                new InMemoryResourceCatalog(List.of(resources)),
                health,
                access,
                new ResourceRequestFactory(name -> Optional.empty()),
                counters,
                executor,
                new ObjectMapper(),
                TestProperties.app(List.of())
        );
    }

    private static RemoteResource resource(String id, ResourceTier tier) {
        return RemoteResource.open(id, "market_data", "https://" + id + ".example", tier);
    }

    private interface Behavior {
        AccessResult apply(String id) throws Exception;

        static Behavior ok(String body) {
            return id -> new AccessResult(
                    new TransportResponse(200, body.getBytes(StandardCharsets.UTF_8)),
                    AccessMethod.DIRECT,
                    List.of(AccessMethod.DIRECT),
                    5
            );
        }

        static Behavior slow(Duration delay, String body) {
            return id -> {
                Thread.sleep(delay.toMillis());
                return ok(body).apply(id);
            };
        }

        static Behavior slowFailure(Duration delay, FetchErrorType type) {
            return id -> {
                Thread.sleep(delay.toMillis());
                return fail(type).apply(id);
            };
        }

        static Behavior fail(FetchErrorType type) {
            return id -> {
                throw new AccessException(type, id + " failed", List.of(AccessMethod.DIRECT), null, null);
            };
        }
    }
}
