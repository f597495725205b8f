package com.cloudimages.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the executor that runs blocking remote storage calls.
 */
@Configuration
public class AsyncConfig {

    /**
     * Thread pool for upload/delete/test-connection calls against remote
     * storage. Request threads wait on these with a bounded timeout.
     */
    @Bean(name = "storageExecutor")
    public ThreadPoolTaskExecutor storageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("storage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
