/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.domain.model.FetchErrorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every candidate of a category was tried, or skipped, without a validated success.
 */
public class ExhaustedException extends RuntimeException {
    private final String category;
    private final int attempted;
    private final Map<String, FetchErrorType> failures;

    public ExhaustedException(String category, int attempted, Map<String, FetchErrorType> failures) {
        super("All resources exhausted for category " + category + " after " + attempted + " attempts");
        this.category = category;
        this.attempted = attempted;
        this.failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public String getCategory() {
        return category;
    }

    public int getAttempted() {
        return attempted;
    }

    /**
     * Last error per attempted resource, in attempt order.
     */
    public Map<String, FetchErrorType> getFailures() {
        return failures;
    }
}
