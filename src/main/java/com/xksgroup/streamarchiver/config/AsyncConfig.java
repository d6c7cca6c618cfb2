package com.xksgroup.streamarchiver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * Runs download jobs. Jobs block for as long as the stream lasts, so the pool is unbounded.
     */
    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor() {
        return Executors.newCachedThreadPool(namedThreads("download-job-"));
    }

    /**
     * Runs the per-channel feed fetches of one poll round.
     */
    @Bean(name = "feedExecutor", destroyMethod = "shutdownNow")
    public ExecutorService feedExecutor(ArchiverProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getFeed().getMaxConcurrentFetches()),
                namedThreads("feed-fetch-"));
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("notify-");
        // Drop on saturation, notifications are fire-and-forget
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Notification pool saturated, dropping a notification"));
        executor.initialize();
        return executor;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
