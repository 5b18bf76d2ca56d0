package com.deepansh.focus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Dedicated thread pools, isolated from the web thread pool.
 *
 * - turnTaskExecutor: runs submitted turns (one at a time per session)
 * - toolTaskExecutor: runs the tool calls of one assistant message concurrently;
 *   falls back to the caller's thread when saturated so a turn never loses a call
 * - cloudCallExecutor / onDeviceCallExecutor: run backend HTTP exchanges so their deadline
 *   can be enforced. One pool per backend and no queue: an abandoned exchange can pin its
 *   thread until the socket times out, and a hung backend must not starve the other one.
 * - traceTaskExecutor: @Async trace persistence
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "turnTaskExecutor")
    public ThreadPoolTaskExecutor turnTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("turn-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("tool-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "cloudCallExecutor")
    public ThreadPoolTaskExecutor cloudCallExecutor() {
        return backendCallExecutor("cloud-call-");
    }

    @Bean(name = "onDeviceCallExecutor")
    public ThreadPoolTaskExecutor onDeviceCallExecutor() {
        return backendCallExecutor("on-device-call-");
    }

    private ThreadPoolTaskExecutor backendCallExecutor(String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(32);
        // Zero capacity hands tasks straight to a thread, starting one if all are busy.
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.initialize();
        return executor;
    }

    @Bean(name = "traceTaskExecutor")
    public ThreadPoolTaskExecutor traceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("trace-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
