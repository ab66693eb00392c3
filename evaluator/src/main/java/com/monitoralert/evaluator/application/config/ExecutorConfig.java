package com.monitoralert.evaluator.application.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the evaluator.
 *
 * Monitors and actions use separate pools so a monitor waiting on its actions never holds
 * the thread an action needs. Both fall back to running on the caller when saturated.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor monitorExecutor(EvaluatorProperties properties) {
        return executor("monitor-", properties.workers().monitorPoolSize(), properties.workers().queueCapacity());
    }

    @Bean
    public ThreadPoolTaskExecutor actionExecutor(EvaluatorProperties properties) {
        return executor("action-", properties.workers().actionPoolSize(), properties.workers().queueCapacity());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
