package com.kats.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named executors. The tail executor has exactly one thread: tail runs never overlap.
 */
@Configuration
public class AsyncConfig {

    public static final String TAIL_EXECUTOR = "tail-executor";

    @Bean(name = TAIL_EXECUTOR)
    public Executor tailExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("tail-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
