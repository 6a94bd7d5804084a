package com.deepansh.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pool for tool handlers.
 *
 * Isolated from the web thread pool so a burst of slow tools never starves
 * request handling. Per-tool semaphores bound each tool's share; the queue
 * provides backpressure, and a full queue surfaces as a handler error on the
 * rejected call only.
 */
@Configuration
public class ToolExecutorConfig {

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor(GatewayProperties properties) {
        GatewayProperties.Tools.Pool pool = properties.getTools().getPool();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCoreSize());
        executor.setMaxPoolSize(pool.getMaxSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("tool-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
