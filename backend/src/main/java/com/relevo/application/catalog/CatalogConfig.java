/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.catalog;

import com.relevo.config.AppProperties;
import com.relevo.domain.model.RemoteResource;
import com.relevo.domain.model.ResourceAuth;
import com.relevo.domain.model.ResourceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;

@Configuration
public class CatalogConfig {
    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public ResourceCatalog resourceCatalog(AppProperties properties) {
        List<RemoteResource> resources = properties.catalog().stream().map(CatalogConfig::toResource).toList();
        InMemoryResourceCatalog catalog = new InMemoryResourceCatalog(resources);
        log.info("Resource catalog loaded resources={} categories={}", resources.size(), catalog.categories());
        return catalog;
    }

    static RemoteResource toResource(AppProperties.CatalogEntry entry) {
        ResourceTier tier;
        try {
            tier = ResourceTier.valueOf(entry.tier().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Resource " + entry.id() + " has unknown tier '" + entry.tier() + "'", e);
        }
        return new RemoteResource(
                entry.id(),
                entry.name(),
                entry.category(),
                entry.baseEndpoint(),
                tier,
                toAuth(entry),
                entry.rateLimit(),
                entry.restricted()
        );
    }

    private static ResourceAuth toAuth(AppProperties.CatalogEntry entry) {
        AppProperties.Auth auth = entry.auth();
        if (auth == null || auth.type() == null) return ResourceAuth.none();
        String type = auth.type().trim().toUpperCase(Locale.ROOT);
        switch (type) {
            case "NONE":
                return ResourceAuth.none();
            case "HEADER":
                return new ResourceAuth.HeaderKey(required(entry, auth.name(), "auth.name"), required(entry, auth.env(), "auth.env"));
            case "QUERY":
                return new ResourceAuth.QueryKey(required(entry, auth.name(), "auth.name"), required(entry, auth.env(), "auth.env"));
            case "PATH":
                if (!entry.baseEndpoint().contains(ResourceAuth.PATH_PLACEHOLDER)) {
                    throw new IllegalStateException("Resource " + entry.id() + " uses PATH auth but base-endpoint has no "
                            + ResourceAuth.PATH_PLACEHOLDER + " placeholder");
                }
                return new ResourceAuth.PathKey(required(entry, auth.env(), "auth.env"));
            default:
                throw new IllegalStateException("Resource " + entry.id() + " has unknown auth type '" + auth.type() + "'");
        }
    }

    private static String required(AppProperties.CatalogEntry entry, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Resource " + entry.id() + " is missing " + field);
        }
        return value.trim();
    }
}
