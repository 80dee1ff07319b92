package com.deepansh.agentplatform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Dedicated thread pools for work that may block on something outside the core.
 *
 * Each pool is isolated so a stuck agent factory never starves event delivery,
 * and a slow dependency never starves either of them.
 * - agentCreationExecutor: agent factory calls, awaited with the caller's deadline
 * - eventDeliveryExecutor: channel writes, awaited with the delivery timeout
 * - dependencyCallExecutor: circuit-protected calls under a TimeLimiter
 *
 * Every pool hands tasks straight to a thread (queue capacity 0) and grows up to
 * its max, so tasks stuck past their timeout never sit in front of anyone
 * else's. Past the max a submit is rejected, which callers treat as a failed
 * attempt.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentCreationExecutor")
    public ThreadPoolTaskExecutor agentCreationExecutor() {
        return buildExecutor("agent-create-", 4, 64);
    }

    @Bean(name = "eventDeliveryExecutor")
    public ThreadPoolTaskExecutor eventDeliveryExecutor() {
        return buildExecutor("event-deliver-", 4, 128);
    }

    @Bean(name = "dependencyCallExecutor")
    public ThreadPoolTaskExecutor dependencyCallExecutor() {
        return buildExecutor("dependency-call-", 2, 16);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
