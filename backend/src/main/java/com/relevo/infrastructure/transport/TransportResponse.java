/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

import java.nio.charset.StandardCharsets;

public record TransportResponse(int status, byte[] body) {
    public TransportResponse {
        if (body == null) body = new byte[0];
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
