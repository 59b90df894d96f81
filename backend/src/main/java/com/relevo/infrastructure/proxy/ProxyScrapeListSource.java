/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.proxy;

import com.relevo.config.AppProperties;
import com.relevo.infrastructure.transport.HttpTransport;
import com.relevo.infrastructure.transport.TransportException;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the plain-text {@code host:port} list served by ProxyScrape (one proxy per line).
 */
@Component
public class ProxyScrapeListSource implements ProxyListSource {
    private static final Logger log = LoggerFactory.getLogger(ProxyScrapeListSource.class);

    private final HttpTransport transport;
    private final URI listUri;

    public ProxyScrapeListSource(HttpTransport transport, AppProperties properties) {
        this.transport = transport;
        this.listUri = URI.create(properties.access().proxy().listUrl());
    }

    @Override
    public List<ProxyAddress> fetch(Duration timeout) {
        try {
            TransportResponse response = transport.send(TransportRequest.get(listUri, Map.of(), timeout));
            if (!response.isSuccess()) {
                log.warn("Proxy listing returned status={}", response.status());
                return List.of();
            }
            return parse(response.bodyAsString());
        } catch (TransportException e) {
            log.warn("Proxy listing unavailable type={}", e.getType());
            return List.of();
        }
    }

    static List<ProxyAddress> parse(String text) {
        List<ProxyAddress> out = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            try {
                out.add(ProxyAddress.parse(trimmed));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed proxy line '{}'", trimmed);
            }
        }
        return out;
    }
}
