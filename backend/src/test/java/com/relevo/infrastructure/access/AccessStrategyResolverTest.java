/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.access;

import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.FetchErrorType;
import com.relevo.infrastructure.dns.DohProvider;
import com.relevo.infrastructure.dns.DohResolver;
import com.relevo.infrastructure.proxy.ProxyAddress;
import com.relevo.infrastructure.proxy.ProxyPool;
import com.relevo.infrastructure.proxy.ProxyRecord;
import com.relevo.infrastructure.transport.Deadline;
import com.relevo.infrastructure.transport.HttpTransport;
import com.relevo.infrastructure.transport.TransportException;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessStrategyResolverTest {
    private static final TransportRequest REQUEST = TransportRequest.get(
            URI.create("https://api.exchange.example/api/v3/ticker?symbol=BTCUSDT"),
            Map.of(),
            Duration.ofSeconds(10)
    );

    @Mock
    private HttpTransport transport;
    @Mock
    private DohResolver dohResolver;
    @Mock
    private ProxyPool proxyPool;

    private AccessStatistics statistics;
    private AccessStrategyResolver resolver;

    @BeforeEach
    void setUp() {
        statistics = new AccessStatistics();
        resolver = new AccessStrategyResolver(transport, dohResolver, proxyPool, statistics);
    }

    @Test
    void unrestrictedResourceGoesDirectOnly() {
        when(transport.send(any())).thenThrow(new TransportException(FetchErrorType.NETWORK_UNREACHABLE, "refused"));

        AccessException ex = assertThrows(AccessException.class, () -> resolver.execute(REQUEST, false));

        assertEquals(List.of(AccessMethod.DIRECT), ex.getTrail());
        verify(transport, times(1)).send(any());
        verifyNoInteractions(dohResolver, proxyPool);
    }

    @Test
    void unrestrictedSuccessNeverTouchesDnsOrProxy() {
        when(transport.send(any())).thenReturn(ok("{}"));

        AccessResult result = resolver.execute(REQUEST, false);

        assertEquals(AccessMethod.DIRECT, result.method());
        verifyNoInteractions(dohResolver, proxyPool);
        assertEquals(1, statistics.snapshot().get(AccessMethod.DIRECT).success());
    }

    @Test
    void restrictedLadderEscalatesInOrderUntilProxySucceeds() {
        ProxyRecord proxy = new ProxyRecord(new ProxyAddress("10.0.0.5", 8080), false, 10);
        when(dohResolver.resolve(eq("api.exchange.example"), eq(DohProvider.CLOUDFLARE), any())).thenReturn(Optional.of("1.1.1.10"));
        when(dohResolver.resolve(eq("api.exchange.example"), eq(DohProvider.GOOGLE), any())).thenReturn(Optional.of("8.8.8.10"));
        when(proxyPool.best(any())).thenReturn(Optional.of(proxy));
        when(transport.send(any()))
                .thenReturn(new TransportResponse(451, new byte[0]))
                .thenThrow(new TransportException(FetchErrorType.TIMEOUT, "timed out"))
                .thenReturn(new TransportResponse(403, new byte[0]))
                .thenReturn(ok("{\"price\":1}"));

        AccessResult result = resolver.execute(REQUEST, true);

        assertEquals(AccessMethod.PROXY, result.method());
        assertEquals(List.of(AccessMethod.DIRECT, AccessMethod.DNS_CLOUDFLARE, AccessMethod.DNS_GOOGLE, AccessMethod.PROXY),
                result.trail());

        InOrder order = inOrder(transport, dohResolver, proxyPool);
        order.verify(transport).send(any());
        order.verify(dohResolver).resolve(eq("api.exchange.example"), eq(DohProvider.CLOUDFLARE), any());
        order.verify(transport).send(any());
        order.verify(dohResolver).resolve(eq("api.exchange.example"), eq(DohProvider.GOOGLE), any());
        order.verify(transport).send(any());
        order.verify(proxyPool).best(any());
        order.verify(transport).send(any());

        ArgumentCaptor<TransportRequest> sent = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport, times(4)).send(sent.capture());
        List<TransportRequest> requests = sent.getAllValues();
        assertNull(requests.get(0).proxy());
        assertEquals("1.1.1.10", requests.get(1).uri().getHost());
        assertEquals("api.exchange.example", requests.get(1).headers().get("Host"));
        assertEquals("api.exchange.example", requests.get(1).tlsServerName());
        assertEquals("8.8.8.10", requests.get(2).uri().getHost());
        assertEquals(new ProxyAddress("10.0.0.5", 8080), requests.get(3).proxy());
        assertEquals("api.exchange.example", requests.get(3).uri().getHost());

        verify(proxyPool).recordSuccess(any(), anyLong());
        assertEquals(1, statistics.snapshot().get(AccessMethod.DNS_CLOUDFLARE).failed());
        assertEquals(1, statistics.snapshot().get(AccessMethod.PROXY).success());
    }

    @Test
    void rateLimitEndsEscalation() {
        when(transport.send(any())).thenReturn(new TransportResponse(429, new byte[0]));

        AccessException ex = assertThrows(AccessException.class, () -> resolver.execute(REQUEST, true));

        assertEquals(FetchErrorType.RATE_LIMITED, ex.getType());
        assertEquals(429, ex.getLastStatus());
        assertEquals(List.of(AccessMethod.DIRECT), ex.getTrail());
        verifyNoInteractions(dohResolver, proxyPool);
    }

    @Test
    void rateLimitMessageInBodyCountsAsRateLimited() {
        TransportResponse response = new TransportResponse(403,
                "{\"error\":\"Rate limit exceeded\"}".getBytes(StandardCharsets.UTF_8));

        assertTrue(AccessStrategyResolver.isRateLimited(response));
        assertTrue(AccessStrategyResolver.isRateLimited(new TransportResponse(429, new byte[0])));
        assertEquals(false, AccessStrategyResolver.isRateLimited(new TransportResponse(500,
                "separate generator".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void exhaustedLadderReportsEveryStep() {
        when(transport.send(any())).thenThrow(new TransportException(FetchErrorType.NETWORK_UNREACHABLE, "refused"));
        when(dohResolver.resolve(any(), any(), any())).thenReturn(Optional.empty());
        when(dohResolver.resolveAny(any(), any())).thenReturn(Optional.empty());
        when(proxyPool.best(any())).thenReturn(Optional.empty());

        AccessException ex = assertThrows(AccessException.class, () -> resolver.execute(REQUEST, true));

        assertEquals(List.of(AccessMethod.values()), ex.getTrail());
        assertEquals(FetchErrorType.NETWORK_UNREACHABLE, ex.getType());
        verify(transport, times(1)).send(any());
    }

    @Test
    void proxyTransportFailureCountsAgainstProxy() {
        ProxyRecord proxy = new ProxyRecord(new ProxyAddress("10.0.0.6", 3128), false, 10);
        when(dohResolver.resolve(any(), any(), any())).thenReturn(Optional.empty());
        when(dohResolver.resolveAny(any(), any())).thenReturn(Optional.empty());
        when(proxyPool.best(any())).thenReturn(Optional.of(proxy));
        when(transport.send(any()))
                .thenReturn(new TransportResponse(403, new byte[0]))
                .thenThrow(new TransportException(FetchErrorType.TIMEOUT, "proxy timed out"));

        assertThrows(AccessException.class, () -> resolver.execute(REQUEST, true));

        verify(proxyPool).recordFailure(proxy);
    }

    @Test
    void directTimeoutStillEscalatesWithAFreshStepBudget() {
        TransportRequest shortRequest = REQUEST.withTimeout(Duration.ofMillis(500));
        when(dohResolver.resolve(eq("api.exchange.example"), eq(DohProvider.CLOUDFLARE), any()))
                .thenReturn(Optional.of("1.1.1.10"));
        when(transport.send(any()))
                .thenAnswer(invocation -> {
                    Thread.sleep(500);
                    throw new TransportException(FetchErrorType.TIMEOUT, "timed out");
                })
                .thenReturn(ok("{}"));

        AccessResult result = resolver.execute(shortRequest, true);

        assertEquals(AccessMethod.DNS_CLOUDFLARE, result.method());
        assertEquals(List.of(AccessMethod.DIRECT, AccessMethod.DNS_CLOUDFLARE), result.trail());
        ArgumentCaptor<TransportRequest> sent = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport, times(2)).send(sent.capture());
        Duration secondTimeout = sent.getAllValues().get(1).timeout();
        assertTrue(secondTimeout.compareTo(Duration.ofMillis(300)) > 0, "second step got " + secondTimeout);
    }

    @Test
    void dnsProxyStepPinsCachedAddressAndGoesThroughProxy() {
        ProxyRecord proxy = new ProxyRecord(new ProxyAddress("10.0.0.7", 3128), false, 10);
        when(dohResolver.resolve(any(), any(), any())).thenReturn(Optional.empty());
        when(dohResolver.resolveAny(eq("api.exchange.example"), any()))
                .thenReturn(Optional.of(new DohResolver.ResolvedAddress("8.8.4.20", DohProvider.GOOGLE)));
        when(proxyPool.best(any())).thenReturn(Optional.of(proxy));
        when(transport.send(any()))
                .thenThrow(new TransportException(FetchErrorType.TIMEOUT, "direct timed out"))
                .thenReturn(new TransportResponse(403, new byte[0]))
                .thenReturn(ok("{\"price\":2}"));

        AccessResult result = resolver.execute(REQUEST, true);

        assertEquals(AccessMethod.DNS_PROXY, result.method());
        assertEquals(List.of(AccessMethod.values()), result.trail());
        ArgumentCaptor<TransportRequest> sent = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport, times(3)).send(sent.capture());
        TransportRequest last = sent.getAllValues().get(2);
        assertEquals("8.8.4.20", last.uri().getHost());
        assertEquals("api.exchange.example", last.headers().get("Host"));
        assertEquals("api.exchange.example", last.tlsServerName());
        assertEquals(new ProxyAddress("10.0.0.7", 3128), last.proxy());
        assertEquals(1, statistics.snapshot().get(AccessMethod.DNS_PROXY).success());
    }

    @Test
    void expiredFetchDeadlineStopsTheLadder() {
        Deadline deadline = Deadline.after(Duration.ofMillis(100));
        when(transport.send(any())).thenAnswer(invocation -> {
            Thread.sleep(150);
            throw new TransportException(FetchErrorType.TIMEOUT, "timed out");
        });

        AccessException ex = assertThrows(AccessException.class, () -> resolver.execute(REQUEST, true, deadline));

        assertEquals(FetchErrorType.TIMEOUT, ex.getType());
        assertEquals(List.of(AccessMethod.DIRECT), ex.getTrail());
        verifyNoInteractions(dohResolver, proxyPool);
    }

    @Test
    void stepTimeoutIsShortenedToTheFetchDeadline() {
        when(transport.send(any())).thenReturn(ok("{}"));

        resolver.execute(REQUEST, false, Deadline.after(Duration.ofMillis(500)));

        ArgumentCaptor<TransportRequest> sent = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(sent.capture());
        assertTrue(sent.getValue().timeout().compareTo(Duration.ofMillis(500)) <= 0);
    }

    private static TransportResponse ok(String body) {
        return new TransportResponse(200, body.getBytes(StandardCharsets.UTF_8));
    }
}
