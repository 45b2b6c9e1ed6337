package com.deepansh.coderflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for blocking tool handlers (remote gateway calls).
 *
 * Kept apart from the web thread pool so slow tools never starve HTTP request
 * handling. Handlers are awaited one at a time per run, so the pool only has
 * to cover concurrent runs.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolTaskExecutor")
    public Executor toolTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("tool-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
