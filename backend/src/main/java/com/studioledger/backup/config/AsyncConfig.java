package com.studioledger.backup.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for background work: one for backup runs, one for the per-destination
 * uploads inside a run, and a single-threaded scheduler for the recurring backup trigger.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    @Value("${backup.upload-pool-size:4}")
    private int uploadPoolSize = 4;

    /**
     * Runs are rare; two threads let a manual run start while a scheduled one finishes.
     */
    @Override
    @Bean(name = "taskExecutor")
    public Executor getAsyncExecutor() {
        return pool("backup-run-", 2, 4, 20, 60);
    }

    /**
     * Every destination of a run uploads the same archive in parallel, up to the pool size.
     */
    @Bean(name = "backupUploadExecutor")
    public Executor backupUploadExecutor() {
        return pool("backup-upload-", uploadPoolSize, uploadPoolSize, 100, 120);
    }

    @Bean(name = "backupTaskScheduler")
    public ThreadPoolTaskScheduler backupTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("backup-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new BackupAsyncExceptionHandler();
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue, int awaitSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);

        // A full queue runs the task on the caller rather than dropping a backup or upload
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitSeconds);
        executor.initialize();

        log.info("Executor {} initialized: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                prefix, core, max, queue);
        return executor;
    }

    /**
     * The backup id is the first argument of every async backup entry point.
     */
    private static class BackupAsyncExceptionHandler implements AsyncUncaughtExceptionHandler {
        @Override
        public void handleUncaughtException(Throwable ex, Method method, Object... params) {
            log.error("Async {} failed with arguments {}: {}",
                    method.getName(), Arrays.toString(params), ex.getMessage(), ex);
        }
    }
}
