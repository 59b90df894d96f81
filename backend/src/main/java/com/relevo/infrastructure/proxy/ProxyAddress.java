/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.proxy;

import java.util.Objects;

/**
 * Forward HTTP proxy endpoint, {@code host:port}.
 */
public record ProxyAddress(String host, int port) {
    public ProxyAddress {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) throw new IllegalArgumentException("proxy host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("proxy port out of range: " + port);
    }

    /**
     * Parses {@code host:port} or {@code http://host:port}; credentials and paths are not supported.
     */
    public static ProxyAddress parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("proxy address is null");
        String s = raw.trim();
        int scheme = s.indexOf("://");
        if (scheme >= 0) s = s.substring(scheme + 3);
        int slash = s.indexOf('/');
        if (slash >= 0) s = s.substring(0, slash);
        int colon = s.lastIndexOf(':');
        if (colon <= 0 || colon == s.length() - 1) {
            throw new IllegalArgumentException("proxy address must be host:port, got '" + raw + "'");
        }
        try {
            return new ProxyAddress(s.substring(0, colon), Integer.parseInt(s.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("proxy port is not a number in '" + raw + "'", e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
