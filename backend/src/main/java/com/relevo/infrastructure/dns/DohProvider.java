/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.dns;

import com.relevo.domain.model.AccessMethod;

public enum DohProvider {
    CLOUDFLARE(AccessMethod.DNS_CLOUDFLARE),
    GOOGLE(AccessMethod.DNS_GOOGLE);

    private final AccessMethod accessMethod;

    DohProvider(AccessMethod accessMethod) {
        this.accessMethod = accessMethod;
    }

    public AccessMethod accessMethod() {
        return accessMethod;
    }
}
