package com.headspace.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 延迟完成捕获使用的工作线程池。线程数计入 {@link LockPoolCapacityCheckRunner} 的连接预算。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    private static final String THREAD_NAME_PREFIX = "deferred-capture-";

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor commonThreadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME_PREFIX + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                saturationHandler(properties.getPolicy()));
        log.info("Deferred capture pool initialized. coreSize={}, maxSize={}, queueCapacity={}, policy={}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return executor;
    }

    // log every saturation before the configured policy decides the task's fate
    private RejectedExecutionHandler saturationHandler(String policy) {
        RejectedExecutionHandler delegate = resolvePolicy(policy);
        return (runnable, executor) -> {
            log.warn("DEFERRED_CAPTURE_SATURATED policy={}, active={}, queued={}",
                    policy, executor.getActiveCount(), executor.getQueue().size());
            delegate.rejectedExecution(runnable, executor);
        };
    }

    private RejectedExecutionHandler resolvePolicy(String policy) {
        if (policy == null) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        switch (policy) {
            case "CallerRunsPolicy":
                return new ThreadPoolExecutor.CallerRunsPolicy();
            case "DiscardPolicy":
                return new ThreadPoolExecutor.DiscardPolicy();
            case "DiscardOldestPolicy":
                return new ThreadPoolExecutor.DiscardOldestPolicy();
            case "AbortPolicy":
                return new ThreadPoolExecutor.AbortPolicy();
            default:
                log.warn("Unknown rejection policy, using AbortPolicy. policy={}", policy);
                return new ThreadPoolExecutor.AbortPolicy();
        }
    }
}
