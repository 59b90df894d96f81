/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.domain.model;

/**
 * Escalation ladder for restricted resources, in the order it is walked.
 */
public enum AccessMethod {
    DIRECT,
    DNS_CLOUDFLARE,
    DNS_GOOGLE,
    PROXY,
    DNS_PROXY
}
