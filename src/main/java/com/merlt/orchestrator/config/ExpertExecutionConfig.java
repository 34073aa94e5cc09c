package com.merlt.orchestrator.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pool the reasoning experts run on. Each request submits one task per selected expert,
 * so the pool bounds how many expert runs proceed in parallel across all requests.
 *
 * <p>A full queue rejects the task instead of running it on the request thread; the dispatcher
 * turns the rejection into a failed opinion for that expert.</p>
 */
@Configuration
public class ExpertExecutionConfig {
    private static final Logger log = LoggerFactory.getLogger(ExpertExecutionConfig.class);
    static final String THREAD_PREFIX = "expert-";

    @Bean(name = {"expertExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor expertExecutor(
            @Value("${merlt.performance.expert-core-threads:4}") int coreThreads,
            @Value("${merlt.performance.expert-max-threads:16}") int maxThreads,
            @Value("${merlt.performance.expert-queue-capacity:200}") int queueCapacity) {
        return expertPool(coreThreads, maxThreads, queueCapacity);
    }

    private static ThreadPoolExecutor expertPool(int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(1, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), expertThreads(), ExpertExecutionConfig::rejectSaturated);
        executor.allowCoreThreadTimeOut(true);
        log.info("Expert pool initialized: core={}, max={}, queue={}", core, max, queue);
        return executor;
    }

    private static ThreadFactory expertThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, THREAD_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void rejectSaturated(Runnable task, ThreadPoolExecutor executor) {
        log.warn("Expert pool saturated: active={}, queued={}, max={}",
                executor.getActiveCount(), executor.getQueue().size(), executor.getMaximumPoolSize());
        throw new RejectedExecutionException("expert pool saturated (" + executor.getActiveCount()
                + " running, " + executor.getQueue().size() + " queued)");
    }
}
