package com.deepansh.sectools.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool that drains stdout/stderr of external processes.
 *
 * Every running process needs two readers at once, so the pool has no queue:
 * a reader that waits in a queue while its process fills the pipe buffer
 * would deadlock that process. When all threads are busy the submission is
 * rejected and the invoker reports it as a failure.
 *
 * Sizing:
 * - Core=8 covers four concurrent scans without creating threads
 * - Max=64 caps concurrency at 32 processes
 * - Idle threads above core die after 60s
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "processStreamExecutor")
    public Executor processStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("process-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
