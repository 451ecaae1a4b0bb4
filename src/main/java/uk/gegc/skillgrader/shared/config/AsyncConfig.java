package uk.gegc.skillgrader.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for asynchronous processing.
 *
 * This configuration provides:
 * - A scoring pool used to fetch reference candidates concurrently
 * - A general pool for post-scoring listeners (reference harvesting, cluster insights)
 * - Logging of uncaught exceptions in async listeners
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.scoring.core-pool-size:4}")
    private int scoringCorePoolSize;

    @Value("${async.scoring.max-pool-size:8}")
    private int scoringMaxPoolSize;

    @Value("${async.scoring.queue-capacity:50}")
    private int scoringQueueCapacity;

    @Value("${async.scoring.keep-alive-seconds:60}")
    private int scoringKeepAliveSeconds;

    @Value("${async.general.core-pool-size:2}")
    private int generalCorePoolSize;

    @Value("${async.general.max-pool-size:4}")
    private int generalMaxPoolSize;

    @Value("${async.general.queue-capacity:25}")
    private int generalQueueCapacity;

    @Value("${async.general.keep-alive-seconds:60}")
    private int generalKeepAliveSeconds;

    /**
     * Executor for reference pool lookups issued in parallel during scoring.
     * Caller-runs on saturation so a busy pool degrades to sequential lookups.
     */
    @Bean(name = "scoringTaskExecutor")
    public ThreadPoolTaskExecutor scoringTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scoringCorePoolSize);
        executor.setMaxPoolSize(scoringMaxPoolSize);
        executor.setQueueCapacity(scoringQueueCapacity);
        executor.setKeepAliveSeconds(scoringKeepAliveSeconds);
        executor.setThreadNamePrefix("scoring-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Scoring Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                scoringCorePoolSize, scoringMaxPoolSize, scoringQueueCapacity, scoringKeepAliveSeconds);

        return executor;
    }

    /**
     * General purpose executor for event listeners that run after a score is returned.
     */
    @Bean(name = "generalTaskExecutor")
    public ThreadPoolTaskExecutor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalCorePoolSize);
        executor.setMaxPoolSize(generalMaxPoolSize);
        executor.setQueueCapacity(generalQueueCapacity);
        executor.setKeepAliveSeconds(generalKeepAliveSeconds);
        executor.setThreadNamePrefix("general-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("General Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                generalCorePoolSize, generalMaxPoolSize, generalQueueCapacity, generalKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generalTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        java.util.Arrays.toString(params), ex);

                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
