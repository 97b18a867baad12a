package uk.gegc.livequiz.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for work that runs after an answer has committed (live progress counters).
 * Nothing scheduled here may affect scores.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    public static final String PROGRESS_EXECUTOR = "progressTaskExecutor";

    @Value("${livequiz.async.progress.core-pool-size:2}")
    private int corePoolSize;

    @Value("${livequiz.async.progress.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${livequiz.async.progress.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = PROGRESS_EXECUTOR)
    public ThreadPoolTaskExecutor progressTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("progress-");
        // a burst of submissions at the end of a countdown can fill the queue
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Progress executor ready (core={}, max={}, queue={})", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return progressTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Async task {}.{} failed",
                method.getDeclaringClass().getSimpleName(), method.getName(), ex);
    }
}
