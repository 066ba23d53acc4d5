package com.kats.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the fixed-period tail trigger. Triggers only enqueue; the work runs on the tail executor.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }
}
