package com.clapgrow.mediarelay.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the relay worker.
 * 
 * - relayTaskScheduler: timed work (reconnect delays, directory polling, temp file cleanup)
 * - relayExecutor: inbound message handling
 * - deliveryExecutor: per-target delivery fan-out, kept apart so a handler
 *   waiting on its deliveries never starves them
 */
@Configuration
public class SchedulerConfig {
    
    @Bean(destroyMethod = "shutdown")
    public TaskScheduler relayTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("relay-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
    
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor relayExecutor(RelayProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(2, properties.getDelivery().getFanOutThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("relay-exec-");
        executor.initialize();
        return executor;
    }
    
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor deliveryExecutor(RelayProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getDelivery().getFanOutThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("relay-delivery-");
        executor.initialize();
        return executor;
    }
}
