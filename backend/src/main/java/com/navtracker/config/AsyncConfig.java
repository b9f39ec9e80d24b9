package com.navtracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pool for per-request wallet fan-out. Each wallet of a refresh runs on its own task;
 * the request joins them before responding.
 */
@Configuration
public class AsyncConfig {

    public static final String REFRESH_EXECUTOR = "refresh-executor";

    @Bean(name = REFRESH_EXECUTOR)
    public ThreadPoolTaskExecutor refreshExecutor(RefreshProperties refreshProperties) {
        int poolSize = Math.max(1, refreshProperties.getPoolSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize);
        e.setQueueCapacity(refreshProperties.getQueueCapacity());
        e.setThreadNamePrefix("refresh-");
        e.initialize();
        return e;
    }
}
