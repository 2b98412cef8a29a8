/**
 * Condition that enables the Redis fast cache only when a Redis endpoint is configured
 *
 * @author William Callahan
 *
 * Features:
 * - Checks for REDIS_SERVER or spring.redis.host
 * - Lets the search cache fall back to a no-op implementation when Redis is absent
 */
package com.williamcallahan.game_catalog_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);
    private static volatile boolean hasLoggedRedisDetection = false;

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        return isRedisConfigured(context.getEnvironment());
    }

    static boolean isRedisConfigured(Environment env) {
        String redisServer = env.getProperty("REDIS_SERVER");
        String redisHost = env.getProperty("spring.redis.host");

        boolean hasRedisConfig = (redisServer != null && !redisServer.isBlank())
            || (redisHost != null && !redisHost.isBlank());

        if (hasRedisConfig && !hasLoggedRedisDetection) {
            logger.info("Redis endpoint detected - enabling fast search cache");
            hasLoggedRedisDetection = true;
        }
        return hasRedisConfig;
    }
}
