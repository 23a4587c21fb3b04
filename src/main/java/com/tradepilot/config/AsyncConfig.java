package com.tradepilot.config;

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

/**
 * Thread pools for the execution engine.
 *
 * <p>{@code laneExecutor} is the bounded worker pool behind the per-instrument lanes
 * of {@link com.tradepilot.engine.ExecutionScheduler}. Each lane keeps at most one
 * task on this pool at a time, so the pool bounds cross-instrument parallelism while
 * same-instrument work stays serial.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${tradepilot.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${tradepilot.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${tradepilot.async.queue-capacity:256}")
    private int queueCapacity;

    @Value("${tradepilot.scheduler.shutdown-timeout-seconds:30}")
    private int awaitTerminationSeconds;

    @Bean("laneExecutor")
    public ThreadPoolTaskExecutor laneExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("lane-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return laneExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
