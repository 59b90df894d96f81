/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

/**
 * How a resource expects its credential. The secret itself is never part of the
 * catalog: {@code env} names the environment variable (or property) to read at call time.
 */
public sealed interface ResourceAuth permits ResourceAuth.None, ResourceAuth.HeaderKey, ResourceAuth.QueryKey, ResourceAuth.PathKey {

    String PATH_PLACEHOLDER = "{key}";

    static ResourceAuth none() {
        return None.INSTANCE;
    }

    default String env() {
        return null;
    }

    default boolean requiresSecret() {
        return env() != null;
    }

    final class None implements ResourceAuth {
        private static final None INSTANCE = new None();

        private None() {}

        @Override
        public String toString() {
            return "None";
        }
    }

    record HeaderKey(String name, String env) implements ResourceAuth {}

    record QueryKey(String name, String env) implements ResourceAuth {}

    /**
     * Secret substituted into the {@code {key}} placeholder of the base endpoint.
     */
    record PathKey(String env) implements ResourceAuth {}
}
