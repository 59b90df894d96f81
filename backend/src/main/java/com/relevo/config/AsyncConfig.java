/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "fetchRaceExecutor")
    public ThreadPoolTaskExecutor fetchRaceExecutor(AppProperties properties) {
        int processors = Runtime.getRuntime().availableProcessors();
        int width = properties.fetch().maxRaceWidth();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(width, processors));
        executor.setMaxPoolSize(Math.max(width * 8, processors * 4));
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("fetch-race-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
