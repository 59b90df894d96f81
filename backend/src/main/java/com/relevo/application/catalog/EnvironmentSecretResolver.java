/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.catalog;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads secrets from environment variables or any other Spring property source, at call time.
 */
@Component
public class EnvironmentSecretResolver implements SecretResolver {
    private final Environment environment;

    public EnvironmentSecretResolver(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> resolve(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String value = environment.getProperty(name);
        if (value == null || value.isBlank()) return Optional.empty();
        return Optional.of(value.trim());
    }
}
