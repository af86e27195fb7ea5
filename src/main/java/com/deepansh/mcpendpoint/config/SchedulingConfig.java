package com.deepansh.mcpendpoint.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for call and aggregation deadlines and the idle sweep.
 *
 * Kept off the WebSocket and HTTP threads. Tasks here only take an agent lock briefly
 * and enqueue sends, so a small pool is enough.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "brokerTaskScheduler")
    public ThreadPoolTaskScheduler brokerTaskScheduler(
            @Value("${scheduling.broker.pool-size:2}") int poolSize,
            @Value("${scheduling.broker.await-termination-seconds:10}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix("broker-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Broker scheduled task failed: {}", throwable.getMessage(), throwable));
        return scheduler;
    }
}
