/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

import com.relevo.infrastructure.proxy.ProxyAddress;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One outbound HTTP exchange.
 *
 * @param tlsServerName when set, the request targets a literal IP and TLS is negotiated with this
 *                      SNI name instead of the URI host; the certificate must still match that name
 */
public record TransportRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        byte[] body,
        ProxyAddress proxy,
        String tlsServerName,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(timeout, "timeout");
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportRequest get(URI uri, Map<String, String> headers, Duration timeout) {
        return new TransportRequest("GET", uri, headers, null, null, null, timeout);
    }

    public TransportRequest withTimeout(Duration newTimeout) {
        return new TransportRequest(method, uri, headers, body, proxy, tlsServerName, newTimeout);
    }

    public TransportRequest viaProxy(ProxyAddress newProxy) {
        return new TransportRequest(method, uri, headers, body, newProxy, tlsServerName, timeout);
    }

    /**
     * Same request aimed at {@code ip}, keeping the original hostname in {@code Host} and SNI.
     */
    public TransportRequest pinnedTo(String ip) {
        String host = uri.getHost();
        StringBuilder target = new StringBuilder(uri.getScheme()).append("://").append(ip);
        if (uri.getPort() != -1) target.append(':').append(uri.getPort());
        if (uri.getRawPath() != null) target.append(uri.getRawPath());
        if (uri.getRawQuery() != null) target.append('?').append(uri.getRawQuery());
        URI rewritten = URI.create(target.toString());
        Map<String, String> pinnedHeaders = new LinkedHashMap<>(headers);
        pinnedHeaders.put("Host", uri.getPort() == -1 ? host : host + ":" + uri.getPort());
        String sni = "https".equalsIgnoreCase(uri.getScheme()) ? host : null;
        return new TransportRequest(method, rewritten, pinnedHeaders, body, proxy, sni, timeout);
    }

    /**
     * URI without its query string, safe to log when keys travel as query parameters.
     */
    public String loggableUri() {
        String s = uri.getScheme() + "://" + uri.getRawAuthority();
        return uri.getRawPath() == null ? s : s + uri.getRawPath();
    }
}
