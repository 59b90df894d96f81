/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.application.catalog.SecretResolver;
import com.relevo.domain.model.RemoteResource;
import com.relevo.domain.model.ResourceAuth;
import com.relevo.infrastructure.transport.TransportRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a {@link RequestSpec} into the concrete request for one resource, attaching its credential.
 */
@Component
public class ResourceRequestFactory {
    private final SecretResolver secretResolver;

    public ResourceRequestFactory(SecretResolver secretResolver) {
        this.secretResolver = secretResolver;
    }

    /**
     * A resource that needs a secret is usable only when the secret resolves or the request carries its own credential.
     */
    public boolean isConfigured(RemoteResource resource, RequestSpec spec) {
        if (!resource.auth().requiresSecret()) return true;
        return secretFor(resource, spec).isPresent();
    }

    public TransportRequest build(RemoteResource resource, RequestSpec spec, Duration timeout) {
        ResourceAuth auth = resource.auth();
        String secret = null;
        if (auth.requiresSecret()) {
            secret = secretFor(resource, spec).orElseThrow(() ->
                    new IllegalStateException("Secret " + auth.env() + " is not set for resource " + resource.id()));
        }

        // every component is encoded exactly once here; secrets and query values strictly
        String base = resource.baseEndpoint();
        if (auth instanceof ResourceAuth.PathKey) {
            base = base.replace(ResourceAuth.PATH_PLACEHOLDER, UriUtils.encode(secret, StandardCharsets.UTF_8));
        }
        String suffix = spec.pathSuffix() == null ? "" : UriUtils.encodePath(spec.pathSuffix(), StandardCharsets.UTF_8);

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(join(base, suffix));
        spec.queryParams().forEach((name, value) -> addQueryParam(builder, name, value));
        if (auth instanceof ResourceAuth.QueryKey query) {
            addQueryParam(builder, query.name(), secret);
        }
        URI uri = builder.build(true).toUri();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", spec.expectJson() ? "application/json" : "*/*");
        headers.putAll(spec.headers());
        if (auth instanceof ResourceAuth.HeaderKey header) {
            headers.put(header.name(), secret);
        }
        return new TransportRequest(spec.method(), uri, headers, spec.body(), null, null, timeout);
    }

    private Optional<String> secretFor(RemoteResource resource, RequestSpec spec) {
        if (spec.authOverride() != null && !spec.authOverride().isBlank()) return Optional.of(spec.authOverride());
        return secretResolver.resolve(resource.auth().env());
    }

    private static void addQueryParam(UriComponentsBuilder builder, String name, String value) {
        String encodedName = UriUtils.encode(name, StandardCharsets.UTF_8);
        if (value == null) {
            builder.queryParam(encodedName);
        } else {
            builder.queryParam(encodedName, UriUtils.encode(value, StandardCharsets.UTF_8));
        }
    }

    static String join(String base, String suffix) {
        if (suffix == null || suffix.isBlank()) return base;
        String left = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String right = suffix.startsWith("/") ? suffix.substring(1) : suffix;
        return left + "/" + right;
    }
}
