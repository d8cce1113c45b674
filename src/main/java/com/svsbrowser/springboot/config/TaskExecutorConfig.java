package com.svsbrowser.springboot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    /**
     * Runs admin-triggered ingestion jobs off the request thread.
     */
    @Bean("ingestionExecutor")
    public TaskExecutor ingestionExecutor(@Value("${app.ingestion.executor.core-size:2}") int coreSize,
                                          @Value("${app.ingestion.executor.max-size:4}") int maxSize,
                                          @Value("${app.ingestion.executor.queue-capacity:20}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("IngestWorker-");
        executor.initialize();
        return executor;
    }
}
