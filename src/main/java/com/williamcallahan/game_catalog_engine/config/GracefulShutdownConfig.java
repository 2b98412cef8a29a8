/**
 * Coordinates shutdown so a running catalog sync stops between batches
 * and Redis is closed only after the executors drain
 *
 * @author William Callahan
 */

package com.williamcallahan.game_catalog_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownConfig.class);
    private static final AtomicBoolean shutdownInitiated = new AtomicBoolean(false);
    private static final long EXECUTOR_DRAIN_TIMEOUT_MS = 30000;

    @Autowired(required = false)
    @Qualifier("taskExecutor")
    private ThreadPoolTaskExecutor taskExecutor;

    @Autowired(required = false)
    @Qualifier("mvcTaskExecutor")
    private ThreadPoolTaskExecutor mvcTaskExecutor;

    @Autowired(required = false)
    private JedisPooled jedisPooled;

    @Autowired
    private ApplicationContext applicationContext;

    /**
     * Checked by long-running loops (the catalog sync) to stop cooperatively
     */
    public static boolean isShuttingDown() {
        return shutdownInitiated.get();
    }

    // The flag is JVM-wide; tests that close a context must clear it again
    static void resetShutdownFlag() {
        shutdownInitiated.set(false);
    }

    @Override
    public void onApplicationEvent(@NonNull ContextClosedEvent event) {
        if (event.getApplicationContext() != applicationContext) {
            return;
        }
        if (!shutdownInitiated.compareAndSet(false, true)) {
            return;
        }
        logger.info("Application shutdown event received - initiating graceful shutdown");

        List<ThreadPoolTaskExecutor> executors = new ArrayList<>();
        if (taskExecutor != null) {
            executors.add(taskExecutor);
        }
        if (mvcTaskExecutor != null) {
            executors.add(mvcTaskExecutor);
        }

        for (ThreadPoolTaskExecutor executor : executors) {
            try {
                executor.shutdown();
            } catch (Exception e) {
                logger.error("Error shutting down executor {}", executor.getThreadNamePrefix(), e);
            }
        }
        waitForExecutors(executors);
        closeRedisConnections();
        logger.info("Graceful shutdown completed");
    }

    private void waitForExecutors(List<ThreadPoolTaskExecutor> executors) {
        long deadline = System.currentTimeMillis() + EXECUTOR_DRAIN_TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            boolean busy = false;
            for (ThreadPoolTaskExecutor executor : executors) {
                int queued = executor.getThreadPoolExecutor() != null
                    ? executor.getThreadPoolExecutor().getQueue().size() : 0;
                if (executor.getActiveCount() > 0 || queued > 0) {
                    logger.info("Executor {}: {} active, {} queued",
                        executor.getThreadNamePrefix(), executor.getActiveCount(), queued);
                    busy = true;
                }
            }
            if (!busy) {
                return;
            }
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for executors", e);
                return;
            }
        }
        logger.warn("Executors did not drain within {}ms, proceeding with shutdown", EXECUTOR_DRAIN_TIMEOUT_MS);
    }

    private void closeRedisConnections() {
        if (jedisPooled == null) {
            return;
        }
        try {
            jedisPooled.close();
            logger.info("Redis connection pool closed");
        } catch (Exception e) {
            logger.error("Error closing Redis connections", e);
        }
    }
}
