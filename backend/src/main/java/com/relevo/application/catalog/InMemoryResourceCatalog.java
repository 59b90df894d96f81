/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.catalog;

import com.relevo.domain.model.RemoteResource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Catalog built once from the declared entries and never mutated afterwards.
 */
public class InMemoryResourceCatalog implements ResourceCatalog {
    private final List<RemoteResource> resources;
    private final Map<String, RemoteResource> byId;
    private final Map<String, List<RemoteResource>> byCategory;

    public InMemoryResourceCatalog(List<RemoteResource> declared) {
        List<RemoteResource> list = declared == null ? List.of() : List.copyOf(declared);
        Map<String, RemoteResource> ids = new LinkedHashMap<>();
        Map<String, List<RemoteResource>> categories = new LinkedHashMap<>();
        for (RemoteResource resource : list) {
            RemoteResource existing = ids.putIfAbsent(resource.id(), resource);
            if (existing != null) {
                throw new IllegalStateException("Duplicate resource id=" + resource.id()
                        + " in categories " + existing.category() + " and " + resource.category());
            }
            categories.computeIfAbsent(resource.category(), c -> new ArrayList<>()).add(resource);
        }
        // List.sort is stable, so equal tiers keep declaration order
        Map<String, List<RemoteResource>> sorted = new LinkedHashMap<>();
        categories.forEach((category, members) -> {
            members.sort(Comparator.comparing(RemoteResource::tier));
            sorted.put(category, List.copyOf(members));
        });
        this.resources = list;
        this.byId = Collections.unmodifiableMap(ids);
        this.byCategory = Collections.unmodifiableMap(sorted);
    }

    @Override
    public List<RemoteResource> listByCategory(String category) {
        if (category == null) return List.of();
        return byCategory.getOrDefault(category, List.of());
    }

    @Override
    public Optional<RemoteResource> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<RemoteResource> all() {
        return resources;
    }

    @Override
    public Set<String> categories() {
        return byCategory.keySet();
    }

    @Override
    public Set<String> requiredSecrets() {
        Set<String> out = new TreeSet<>();
        for (RemoteResource resource : resources) {
            if (resource.auth().requiresSecret()) out.add(resource.auth().env());
        }
        return Collections.unmodifiableSet(out);
    }
}
