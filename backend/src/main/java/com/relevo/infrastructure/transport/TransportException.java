/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

import com.relevo.domain.model.FetchErrorType;

/**
 * The exchange produced no HTTP response at all (timeout, refused, unresolvable).
 */
public class TransportException extends RuntimeException {
    private final FetchErrorType type;

    public TransportException(FetchErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public TransportException(FetchErrorType type, String message) {
        this(type, message, null);
    }

    public FetchErrorType getType() {
        return type;
    }
}
