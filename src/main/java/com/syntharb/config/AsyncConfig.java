package com.syntharb.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work that must stay off the caller's thread: per-client socket writes
 * and asynchronous feed ingestion.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${syntharb.broadcast.core-pool-size}")
    private int broadcastCorePoolSize;

    @Value("${syntharb.broadcast.max-pool-size}")
    private int broadcastMaxPoolSize;

    @Value("${syntharb.broadcast.queue-capacity}")
    private int broadcastQueueCapacity;

    @Value("${syntharb.ingestion.pool-size}")
    private int ingestionPoolSize;

    @Bean("broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(broadcastCorePoolSize);
        executor.setMaxPoolSize(broadcastMaxPoolSize);
        executor.setQueueCapacity(broadcastQueueCapacity);
        executor.setThreadNamePrefix("broadcast-");
        // A rejected drain task releases only the affected client.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean("ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestionPoolSize);
        executor.setMaxPoolSize(ingestionPoolSize);
        executor.setThreadNamePrefix("ingest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
