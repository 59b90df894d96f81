/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What to ask every candidate for. The path suffix is appended to each resource's base endpoint;
 * credentials are attached per resource unless {@code authOverride} supplies one for all of them.
 */
public record RequestSpec(
        String method,
        String pathSuffix,
        Map<String, String> queryParams,
        Map<String, String> headers,
        byte[] body,
        String authOverride,
        boolean expectJson
) {
    public RequestSpec {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase();
        pathSuffix = pathSuffix == null ? "" : pathSuffix;
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static RequestSpec get(String pathSuffix) {
        return new RequestSpec("GET", pathSuffix, Map.of(), Map.of(), null, null, false);
    }

    public RequestSpec withQueryParam(String name, String value) {
        Map<String, String> params = new LinkedHashMap<>(queryParams);
        params.put(name, value);
        return new RequestSpec(method, pathSuffix, params, headers, body, authOverride, expectJson);
    }

    public RequestSpec withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new RequestSpec(method, pathSuffix, queryParams, copy, body, authOverride, expectJson);
    }

    public RequestSpec expectingJson() {
        return new RequestSpec(method, pathSuffix, queryParams, headers, body, authOverride, true);
    }
}
