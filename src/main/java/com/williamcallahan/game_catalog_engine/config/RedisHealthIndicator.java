/**
 * Health indicator for the Redis fast cache
 *
 * @author William Callahan
 */

package com.williamcallahan.game_catalog_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Conditional;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component("redisHealthIndicator")
@Conditional(RedisEnvironmentCondition.class)
public class RedisHealthIndicator implements HealthIndicator {

    private final JedisPooled jedisPooled;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong lastSuccessTime = new AtomicLong(System.currentTimeMillis());

    @Value("${app.cache.redis.health-failure-threshold:3}")
    private int failureThreshold = 3;

    public RedisHealthIndicator(JedisPooled jedisPooled) {
        this.jedisPooled = jedisPooled;
    }

    /**
     * Pings Redis. A search never fails because of Redis, so a single failed ping
     * is reported as UNKNOWN and only repeated failures as DOWN.
     */
    @Override
    public Health health() {
        try {
            String response = jedisPooled.ping();
            if ("PONG".equalsIgnoreCase(response)) {
                consecutiveFailures.set(0);
                lastSuccessTime.set(System.currentTimeMillis());
                return Health.up()
                    .withDetail("redis_status", "available")
                    .build();
            }
            return failure(Health.unknown(), "unknown_response").withDetail("response", response).build();
        } catch (Exception ex) {
            return failure(Health.unknown(), "unavailable")
                .withDetail("error", ex.getClass().getName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build();
        }
    }

    private Health.Builder failure(Health.Builder builder, String status) {
        int failures = consecutiveFailures.incrementAndGet();
        Health.Builder target = failures >= failureThreshold ? Health.down() : builder;
        return target
            .withDetail("redis_status", status)
            .withDetail("consecutive_failures", failures)
            .withDetail("last_success_ms_ago", System.currentTimeMillis() - lastSuccessTime.get());
    }
}
