/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.access;

import com.relevo.domain.model.AccessMethod;
import com.relevo.domain.model.FetchErrorType;

import java.util.List;

/**
 * Every allowed access method failed for one call.
 */
public class AccessException extends RuntimeException {
    private final FetchErrorType type;
    private final List<AccessMethod> trail;
    private final Integer lastStatus;

    public AccessException(FetchErrorType type, String message, List<AccessMethod> trail, Integer lastStatus, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.trail = List.copyOf(trail);
        this.lastStatus = lastStatus;
    }

    public FetchErrorType getType() {
        return type;
    }

    public List<AccessMethod> getTrail() {
        return trail;
    }

    public Integer getLastStatus() {
        return lastStatus;
    }
}
