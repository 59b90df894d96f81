/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.dns;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relevo.config.AppProperties;
import com.relevo.infrastructure.transport.Deadline;
import com.relevo.infrastructure.transport.HttpTransport;
import com.relevo.infrastructure.transport.TransportException;
import com.relevo.infrastructure.transport.TransportRequest;
import com.relevo.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves A records through the DNS-over-HTTPS JSON API of Cloudflare or Google.
 */
@Component
public class DohResolver {
    private static final Logger log = LoggerFactory.getLogger(DohResolver.class);
    private static final int A_RECORD = 1;

    private final HttpTransport transport;
    private final DnsCache cache;
    private final ObjectMapper objectMapper;
    private final Map<DohProvider, String> endpoints = new EnumMap<>(DohProvider.class);
    private final Duration lookupTimeout;

    public DohResolver(HttpTransport transport, DnsCache cache, ObjectMapper objectMapper, AppProperties properties) {
        this.transport = transport;
        this.cache = cache;
        this.objectMapper = objectMapper;
        AppProperties.Access.Dns dns = properties.access().dns();
        this.endpoints.put(DohProvider.CLOUDFLARE, dns.cloudflareUrl());
        this.endpoints.put(DohProvider.GOOGLE, dns.googleUrl());
        this.lookupTimeout = dns.lookupTimeout();
    }

    public Optional<String> resolve(String hostname, DohProvider provider) {
        return resolve(hostname, provider, Deadline.none());
    }

    /**
     * Resolves through one provider, serving a fresh cached answer from the same provider first. The
     * lookup never outlives {@code deadline}.
     */
    public Optional<String> resolve(String hostname, DohProvider provider, Deadline deadline) {
        Optional<DnsCacheEntry> cached = cache.lookup(hostname, provider);
        if (cached.isPresent()) {
            String ip = cached.get().pickAddress();
            log.debug("DNS cache hit host={} provider={} ip={}", hostname, provider, ip);
            return Optional.of(ip);
        }
        return query(hostname, provider, deadline).map(DnsCacheEntry::pickAddress);
    }

    public Optional<ResolvedAddress> resolveAny(String hostname) {
        return resolveAny(hostname, Deadline.none());
    }

    /**
     * Any cached answer wins; otherwise Cloudflare then Google while {@code deadline} allows.
     */
    public Optional<ResolvedAddress> resolveAny(String hostname, Deadline deadline) {
        Optional<DnsCacheEntry> cached = cache.lookup(hostname);
        if (cached.isPresent()) {
            return Optional.of(new ResolvedAddress(cached.get().pickAddress(), cached.get().provider()));
        }
        for (DohProvider provider : DohProvider.values()) {
            Optional<DnsCacheEntry> answer = query(hostname, provider, deadline);
            if (answer.isPresent()) {
                return Optional.of(new ResolvedAddress(answer.get().pickAddress(), provider));
            }
        }
        return Optional.empty();
    }

    private Optional<DnsCacheEntry> query(String hostname, DohProvider provider, Deadline deadline) {
        if (deadline.isExpired()) {
            log.debug("DoH lookup skipped, no time left provider={} host={}", provider, hostname);
            return Optional.empty();
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(endpoints.get(provider))
                .queryParam("name", hostname)
                .queryParam("type", "A")
                .build()
                .toUri();
        try {
            TransportResponse response = transport.send(
                    TransportRequest.get(uri, Map.of("Accept", "application/dns-json"), deadline.cap(lookupTimeout))
            );
            if (!response.isSuccess()) {
                log.warn("DoH lookup failed provider={} host={} status={}", provider, hostname, response.status());
                return Optional.empty();
            }
            List<String> ips = parseAnswers(response.body());
            if (ips.isEmpty()) {
                log.warn("DoH lookup returned no A records provider={} host={}", provider, hostname);
                return Optional.empty();
            }
            DnsCacheEntry entry = cache.put(hostname, ips, provider);
            log.info("DoH resolved host={} provider={} addresses={}", hostname, provider, ips.size());
            return Optional.of(entry);
        } catch (TransportException e) {
            log.warn("DoH lookup failed provider={} host={} type={}", provider, hostname, e.getType());
            return Optional.empty();
        }
    }

    List<String> parseAnswers(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode answers = root.path("Answer");
            List<String> ips = new ArrayList<>();
            if (!answers.isArray()) return ips;
            for (JsonNode answer : answers) {
                if (answer.path("type").asInt() == A_RECORD) {
                    String data = answer.path("data").asText("");
                    if (!data.isBlank()) ips.add(data);
                }
            }
            return ips;
        } catch (IOException e) {
            log.warn("DoH answer is not valid JSON: {}", e.getMessage());
            return List.of();
        }
    }

    public record ResolvedAddress(String ip, DohProvider provider) {}
}
