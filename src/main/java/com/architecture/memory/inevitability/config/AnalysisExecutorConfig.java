package com.architecture.memory.inevitability.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for parallel analysis (goals, MCS candidate chunks).
 *
 * The pool has no queue: when every worker is busy a task runs on the submitting thread.
 * Goal tasks submit MCS chunks to the same pool, so this keeps nested submissions from
 * waiting on each other.
 */
@Configuration
@Slf4j
public class AnalysisExecutorConfig {

    @Value("${inevitability.workers.pool-size:4}")
    private int poolSize;

    @Value("${inevitability.workers.await-termination-seconds:30}")
    private int awaitTerminationSeconds;

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        log.info("[Analysis Executor] Initializing worker pool with {} threads", poolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }
}
