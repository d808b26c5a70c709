package com.kotsin.crossimpact.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * AsyncConfig - Worker pool for the per-symbol stage (screening, OFI, PCA, returns).
 *
 * Symbols are independent, so each one is a task on a fixed pool. When the queue is
 * full the submitting thread runs the task itself (backpressure, nothing dropped). Once the
 * pool is shut down a submission is rejected with {@link RejectedExecutionException}.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor(AnalysisConfig config) {
        AnalysisConfig.Executor settings = config.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadPrefix());

        executor.setRejectedExecutionHandler((r, e) -> {
            if (e.isShutdown()) {
                log.error("[ANALYSIS-EXECUTOR] Task rejected, executor is shut down");
                throw new RejectedExecutionException("analysisExecutor is shut down");
            }
            log.warn("[ANALYSIS-EXECUTOR] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                e.getActiveCount(), e.getQueue().size());
            r.run();
        });

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("[ANALYSIS-EXECUTOR] Initialized: poolSize={}, queueCapacity={}, threadPrefix={}",
            settings.getPoolSize(), settings.getQueueCapacity(), settings.getThreadPrefix());
        return executor;
    }
}
