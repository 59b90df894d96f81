/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

import com.relevo.domain.model.FetchErrorType;
import com.relevo.infrastructure.proxy.ProxyAddress;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Reactor Netty backed transport. Direct and IP-pinned clients are pooled, one per SNI name, and
 * the SNI names come from the catalog hosts. Proxied clients are built per call on unpooled
 * connections since the proxy pool rotates its members.
 */
@Component
public class WebClientHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(WebClientHttpTransport.class);
    private static final int CONNECT_TIMEOUT_MS = 5_000;
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private final Map<ClientKey, WebClient> pooledClients = new ConcurrentHashMap<>();
    private volatile SslContext pinnedSslContext;

    @Override
    public TransportResponse send(TransportRequest request) {
        WebClient client = clientFor(request);
        try {
            WebClient.RequestBodySpec spec = client.method(HttpMethod.valueOf(request.method()))
                    .uri(request.uri())
                    .headers(h -> request.headers().forEach(h::set));
            WebClient.RequestHeadersSpec<?> ready = request.body() == null ? spec : spec.bodyValue(request.body());
            TransportResponse response = ready
                    .exchangeToMono(res -> res.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(bytes -> new TransportResponse(res.statusCode().value(), bytes)))
                    .timeout(request.timeout())
                    .block();
            if (response == null) {
                throw new TransportException(FetchErrorType.UPSTREAM_ERROR, "Empty exchange for " + request.loggableUri());
            }
            return response;
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw classify(request, e);
        }
    }

    private TransportException classify(TransportRequest request, RuntimeException e) {
        Throwable root = Exceptions.unwrap(e);
        if (root instanceof WebClientRequestException && root.getCause() != null) {
            root = root.getCause();
        }
        // connection refused, unresolvable host, TLS failures and anything else without a response
        FetchErrorType type = FetchErrorType.NETWORK_UNREACHABLE;
        if (root instanceof TimeoutException || root instanceof ReadTimeoutException || root instanceof ConnectTimeoutException) {
            type = FetchErrorType.TIMEOUT;
        }
        log.debug("Transport failure type={} uri={} proxy={} cause={}", type, request.loggableUri(), request.proxy(), root.toString());
        return new TransportException(type, type.name().toLowerCase() + " calling " + request.loggableUri(), root);
    }

    private WebClient clientFor(TransportRequest request) {
        if (request.proxy() != null) {
            return buildClient(HttpClient.newConnection(), request.proxy(), request.tlsServerName());
        }
        return pooledClients.computeIfAbsent(
                new ClientKey(request.tlsServerName()),
                key -> buildClient(HttpClient.create(), null, key.tlsServerName())
        );
    }

    int pooledClientCount() {
        return pooledClients.size();
    }

    private WebClient buildClient(HttpClient base, ProxyAddress proxy, String tlsServerName) {
        HttpClient httpClient = base
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .followRedirect(true);

        if (proxy != null) {
            httpClient = httpClient.proxy(spec -> spec.type(ProxyProvider.Proxy.HTTP)
                    .host(proxy.host())
                    .port(proxy.port())
                    .connectTimeoutMillis(CONNECT_TIMEOUT_MS));
        }

        if (tlsServerName != null) {
            SslContext sslContext = pinnedSslContext();
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext)
                    .handlerConfigurator(handler -> pinServerName(handler.engine(), tlsServerName)));
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }

    /**
     * The connection targets a literal IP; SNI carries the real hostname and the certificate is
     * verified against that name.
     */
    static void pinServerName(SSLEngine engine, String serverName) {
        SSLParameters params = engine.getSSLParameters();
        params.setServerNames(List.of(new SNIHostName(serverName)));
        params.setEndpointIdentificationAlgorithm("HTTPS");
        engine.setSSLParameters(params);
    }

    private SslContext pinnedSslContext() {
        SslContext ctx = pinnedSslContext;
        if (ctx != null) return ctx;
        synchronized (this) {
            if (pinnedSslContext == null) {
                try {
                    pinnedSslContext = SslContextBuilder.forClient()
                            .sslProvider(SslProvider.JDK)
                            .build();
                } catch (SSLException e) {
                    throw new IllegalStateException("Unable to build TLS context for pinned-IP requests", e);
                }
            }
            return pinnedSslContext;
        }
    }

    private record ClientKey(String tlsServerName) {}
}
