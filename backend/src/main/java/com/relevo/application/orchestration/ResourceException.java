/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.domain.model.FetchErrorType;

/**
 * One failed attempt against one resource. The message never carries credentials.
 */
public class ResourceException extends RuntimeException {
    private final String resourceId;
    private final FetchErrorType type;
    private final String safeMessage;

    public ResourceException(String resourceId, FetchErrorType type, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.resourceId = resourceId;
        this.type = type;
        this.safeMessage = safeMessage;
    }

    public ResourceException(String resourceId, FetchErrorType type, String safeMessage) {
        this(resourceId, type, safeMessage, null);
    }

    public String getResourceId() {
        return resourceId;
    }

    public FetchErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
