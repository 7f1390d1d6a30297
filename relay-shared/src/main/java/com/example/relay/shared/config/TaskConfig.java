package com.example.relay.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Thread pool for @Scheduled sweeps.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Inbound WebSocket messages touch the store and take per-device locks, so they
     * are processed here instead of on the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler relayWorkScheduler() {
        int threadCap = 64;
        int queuedTaskCap = 100000;
        return Schedulers.newBoundedElastic(threadCap, queuedTaskCap, "relay-work-");
    }
}
