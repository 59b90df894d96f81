/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelevoApplication {
    public static void main(String[] args) {
        SpringApplication.run(RelevoApplication.class, args);
    }
}
