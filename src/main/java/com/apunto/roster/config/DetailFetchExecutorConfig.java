package com.apunto.roster.config;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;

@Configuration
public class DetailFetchExecutorConfig {

    /**
     * Pool for per-character profile calls. Its size is the upper bound on concurrent
     * Battle.net detail requests across all running syncs.
     */
    @Bean(name = "detailFetchExecutor")
    public ThreadPoolTaskExecutor detailFetchExecutor(
            @Value("${profile-sync.detail-fetch.concurrency:1}") int threads,
            @Value("${profile-sync.detail-fetch.queue:500}") int queueCapacity
    ) {
        int size = Math.max(1, threads);

        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(size);
        exec.setMaxPoolSize(size);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix("detail-fetch-");

        exec.setRejectedExecutionHandler(callerRunsUnlessShutdown());

        exec.setTaskDecorator(runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                // may execute on the sync thread itself (saturated pool), so restore instead of clear
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) MDC.setContextMap(context);
                try {
                    runnable.run();
                } finally {
                    if (previous != null) MDC.setContextMap(previous);
                    else MDC.clear();
                }
            };
        });

        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(30);

        exec.initialize();
        return exec;
    }

    /**
     * Saturated pool: the sync thread fetches the detail itself. Pool shutting down: the task is
     * refused with {@link RejectedExecutionException} rather than dropped, so no caller waits on it.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("detailFetchExecutor is shut down");
            }
            task.run();
        };
    }
}
