/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.infrastructure.transport;

public interface HttpTransport {
    /**
     * Performs the exchange, returning any HTTP response including non-2xx ones.
     *
     * @throws TransportException when no response could be obtained
     */
    TransportResponse send(TransportRequest request);
}
