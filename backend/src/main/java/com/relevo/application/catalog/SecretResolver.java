/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.catalog;

import java.util.Optional;

public interface SecretResolver {
    Optional<String> resolve(String name);
}
