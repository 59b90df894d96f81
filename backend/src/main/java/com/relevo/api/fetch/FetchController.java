/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.api.fetch;

import com.relevo.api.ApiException;
import com.relevo.application.catalog.ResourceCatalog;
import com.relevo.application.orchestration.FallbackOrchestrator;
import com.relevo.application.orchestration.FetchMode;
import com.relevo.application.orchestration.FetchOptions;
import com.relevo.application.orchestration.FetchResult;
import com.relevo.application.orchestration.RequestSpec;
import com.relevo.config.AppProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fetches from a category. Query parameters other than the control ones below are forwarded to the
 * chosen resource unchanged.
 */
@RestController
@RequestMapping("/api/fetch")
public class FetchController {
    public static final String HEADER_RESOURCE = "X-Resource-Id";
    public static final String HEADER_TIER = "X-Resource-Tier";
    public static final String HEADER_ACCESS = "X-Access-Method";
    public static final String HEADER_ATTEMPTS = "X-Attempts";

    private static final Set<String> CONTROL_PARAMS = Set.of("path", "maxAttempts", "mode", "raceWidth", "deadlineMs", "json");

    private final FallbackOrchestrator orchestrator;
    private final ResourceCatalog catalog;
    private final AppProperties properties;

    public FetchController(FallbackOrchestrator orchestrator, ResourceCatalog catalog, AppProperties properties) {
        this.orchestrator = orchestrator;
        this.catalog = catalog;
        this.properties = properties;
    }

    @GetMapping("/{category}")
    public ResponseEntity<byte[]> fetch(
            @PathVariable String category,
            @RequestParam(name = "path", required = false, defaultValue = "") String path,
            @RequestParam(name = "maxAttempts", required = false) Integer maxAttempts,
            @RequestParam(name = "mode", required = false, defaultValue = "SEQUENTIAL") String mode,
            @RequestParam(name = "raceWidth", required = false, defaultValue = "0") int raceWidth,
            @RequestParam(name = "deadlineMs", required = false) Long deadlineMs,
            @RequestParam(name = "json", required = false, defaultValue = "true") boolean json,
            @RequestParam Map<String, String> params
    ) {
        if (catalog.listByCategory(category).isEmpty()) {
            throw new ApiException(HttpStatus.NOT_FOUND, "Unknown category " + category);
        }

        Map<String, String> forwarded = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (!CONTROL_PARAMS.contains(name)) forwarded.put(name, value);
        });
        RequestSpec spec = new RequestSpec("GET", path, forwarded, Map.of(), null, null, json);

        FetchOptions options = new FetchOptions(
                parseMode(mode),
                raceWidth,
                deadlineMs == null ? null : Duration.ofMillis(deadlineMs)
        );
        int attempts = maxAttempts == null ? properties.fetch().defaultMaxAttempts() : maxAttempts;

        FetchResult result = orchestrator.fetch(category, spec, attempts, options);
        return ResponseEntity.ok()
                .contentType(json ? MediaType.APPLICATION_JSON : MediaType.APPLICATION_OCTET_STREAM)
                .header(HEADER_RESOURCE, result.resourceId())
                .header(HEADER_TIER, result.tier().name())
                .header(HEADER_ACCESS, result.accessMethod().name())
                .header(HEADER_ATTEMPTS, String.valueOf(result.attempts()))
                .body(result.payload());
    }

    private static FetchMode parseMode(String raw) {
        try {
            return FetchMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown fetch mode " + raw);
        }
    }
}
