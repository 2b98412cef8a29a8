/**
 * Thread pools for asynchronous work
 *
 * @author William Callahan
 *
 * Features:
 * - taskExecutor runs admin-triggered and credential-triggered catalog syncs
 * - mvcTaskExecutor serves async MVC requests
 * - A saturated pool runs the task on the caller; a shut-down pool rejects it
 */

package com.williamcallahan.game_catalog_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;

@Configuration
public class AsyncConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    @Override
    public void configureAsyncSupport(@NonNull AsyncSupportConfigurer configurer) {
        configurer.setDefaultTimeout(60000);
        configurer.setTaskExecutor(mvcTaskExecutor());
    }

    @Bean("mvcTaskExecutor")
    public AsyncTaskExecutor mvcTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(10);
        executor.setMaxPoolSize(50);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("mvc-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for catalog syncs started outside the scheduler.
     */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("catalog-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.initialize();
        return executor;
    }

    /**
     * Like {@link java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy}, except that a task
     * offered after shutdown is rejected instead of dropped, so callers waiting on it fail fast.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, pool) -> {
            if (pool.isShutdown()) {
                logger.warn("Rejecting task submitted after executor shutdown");
                throw new RejectedExecutionException("Executor has been shut down");
            }
            task.run();
        };
    }
}
