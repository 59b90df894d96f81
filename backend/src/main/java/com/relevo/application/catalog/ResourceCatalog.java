/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.catalog;

import com.relevo.domain.model.RemoteResource;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ResourceCatalog {
    /**
     * Resources of a category ordered by tier, ties in declaration order. Unknown categories yield
     * an empty list.
     */
    List<RemoteResource> listByCategory(String category);

    Optional<RemoteResource> get(String id);

    List<RemoteResource> all();

    Set<String> categories();

    /**
     * Environment variable names referenced by any entry, sorted.
     */
    Set<String> requiredSecrets();
}
