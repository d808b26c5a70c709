package com.kotsin.crossimpact.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Analysis Executor Tests")
class AsyncConfigTest {

    @Test
    @DisplayName("Saturated pool runs the task in the submitting thread")
    void testCallerRunsWhenQueueFull() throws InterruptedException {
        AnalysisConfig config = new AnalysisConfig();
        config.getExecutor().setPoolSize(1);
        config.getExecutor().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().analysisExecutor(config);

        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> awaitQuietly(release));
            executor.execute(() -> { });

            AtomicReference<String> ranOn = new AtomicReference<>();
            executor.execute(() -> ranOn.set(Thread.currentThread().getName()));

            assertEquals(Thread.currentThread().getName(), ranOn.get());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Submitting to a shut-down pool is rejected instead of silently dropped")
    void testRejectAfterShutdown() {
        Executor bean = new AsyncConfig().analysisExecutor(new AnalysisConfig());
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) bean;
        executor.shutdown();

        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
