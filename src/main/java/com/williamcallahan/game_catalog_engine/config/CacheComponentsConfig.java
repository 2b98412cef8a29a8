/**
 * Chooses the fast-cache implementation
 *
 * @author William Callahan
 *
 * Features:
 * - Redis-backed cache when a Redis endpoint is configured
 * - No-op cache otherwise, so search falls straight through to Postgres
 */
package com.williamcallahan.game_catalog_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.service.cache.GameSearchCache;
import com.williamcallahan.game_catalog_engine.service.cache.NoOpGameSearchCache;
import com.williamcallahan.game_catalog_engine.service.cache.RedisGameSearchCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPooled;

@Configuration
public class CacheComponentsConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheComponentsConfig.class);

    @Bean
    @Conditional(RedisEnvironmentCondition.class)
    public GameSearchCache redisGameSearchCache(JedisPooled jedisPooled,
                                                ObjectMapper objectMapper,
                                                MetricsService metricsService) {
        return new RedisGameSearchCache(jedisPooled, objectMapper, metricsService);
    }

    @Bean
    @ConditionalOnMissingBean(GameSearchCache.class)
    public GameSearchCache noOpGameSearchCache() {
        logger.info("Redis not configured - search results will not be fast-cached");
        return new NoOpGameSearchCache();
    }
}
