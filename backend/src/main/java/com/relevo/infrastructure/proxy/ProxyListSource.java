/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.proxy;

import java.time.Duration;
import java.util.List;

/**
 * External listing of candidate forward proxies.
 */
public interface ProxyListSource {
    /**
     * @return the listed proxies, or an empty list when the listing could not be read within {@code timeout}
     */
    List<ProxyAddress> fetch(Duration timeout);
}
