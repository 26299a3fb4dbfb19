package com.example.reelreply.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Executors for the monitoring timer, cycle runs and per-reel comment fetches.
 */
@Configuration
public class AsyncConfig {

    /** Fires timer ticks only; cycles are handed off to {@link #monitoringExecutor()}. */
    @Bean(name = "monitoringTaskScheduler")
    public ThreadPoolTaskScheduler monitoringTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("monitor-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "monitoringExecutor")
    public Executor monitoringExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("monitor-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "contentExecutor")
    public Executor contentExecutor(AutoReplyProperties properties) {
        int parallelism = Math.max(1, properties.getMonitoring().getItemFetchParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("content-");
        executor.initialize();
        return executor;
    }
}
