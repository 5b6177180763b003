package com.nodeguardian.config;

import com.nodeguardian.engine.GuardianEngineConfig;
import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Executors of the control loop.
 *
 * <ul>
 *   <li>{@code evaluationExecutor} -- runs (rule, node) evaluations; its pool size is the global
 *       concurrency cap; a key is queued at most once because its slot is claimed at submit time</li>
 *   <li>{@code ioExecutor} -- metric fetches, node mutations and channel sends, each awaited
 *       with a bounded timeout</li>
 *   <li>{@code eventExecutor} -- async status listeners</li>
 *   <li>{@code guardianTaskScheduler} -- per-rule timers and the recovery sweep</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private final GuardianEngineConfig guardianEngineConfig;

    @Value("${nodeguardian.async.evaluation-queue-capacity:1000}")
    private int evaluationQueueCapacity;

    @Value("${nodeguardian.async.io-pool-size:20}")
    private int ioPoolSize;

    @Value("${nodeguardian.async.event-pool-size:2}")
    private int eventPoolSize;

    @Value("${nodeguardian.async.scheduler-pool-size:4}")
    private int schedulerPoolSize;

    public AsyncConfig(GuardianEngineConfig guardianEngineConfig) {
        this.guardianEngineConfig = guardianEngineConfig;
    }

    @Bean("evaluationExecutor")
    public ThreadPoolTaskExecutor evaluationExecutor() {
        int cap = guardianEngineConfig.getMaxConcurrentEvaluations();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cap);
        executor.setMaxPoolSize(cap);
        executor.setQueueCapacity(evaluationQueueCapacity);
        executor.setThreadNamePrefix("eval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("ioExecutor")
    public ThreadPoolTaskExecutor ioExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ioPoolSize);
        executor.setMaxPoolSize(ioPoolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventPoolSize);
        executor.setMaxPoolSize(eventPoolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean("guardianTaskScheduler")
    public ThreadPoolTaskScheduler guardianTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("guardian-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
