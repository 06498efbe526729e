package com.example.rcaengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Executors for RCA runs, per-candidate feature extraction and retraining,
 * plus the scheduler used for debounced RCA triggers.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "rcaExecutor")
    public ThreadPoolTaskExecutor rcaExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("rca-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(RcaProperties properties) {
        int parallelism = Math.max(1, properties.getRuns().getExtractionParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("extract-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "retrainExecutor")
    public ThreadPoolTaskExecutor retrainExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("retrain-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "rcaTriggerScheduler")
    public ThreadPoolTaskScheduler rcaTriggerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("rca-trigger-");
        scheduler.initialize();
        return scheduler;
    }
}
