/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

import java.util.Objects;

/**
 * Immutable catalog entry for one remote resource.
 */
public record RemoteResource(
        String id,
        String name,
        String category,
        String baseEndpoint,
        ResourceTier tier,
        ResourceAuth auth,
        String declaredRateLimit,
        boolean restricted
) {
    public RemoteResource {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(baseEndpoint, "baseEndpoint");
        Objects.requireNonNull(tier, "tier");
        if (id.isBlank()) throw new IllegalArgumentException("resource id must not be blank");
        if (name == null || name.isBlank()) name = id;
        if (auth == null) auth = ResourceAuth.none();
    }

    public static RemoteResource open(String id, String category, String baseEndpoint, ResourceTier tier) {
        return new RemoteResource(id, id, category, baseEndpoint, tier, ResourceAuth.none(), null, false);
    }
}
