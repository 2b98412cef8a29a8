/**
 * Redis implementation of the game search fast cache
 *
 * @author William Callahan
 *
 * Features:
 * - Stores id lists as JSON with SETEX so every entry expires
 * - Treats any Redis or JSON failure as a cache miss
 * - Deletes key families with SCAN rather than KEYS
 * - Stops touching Redis once shutdown has begun
 */

package com.williamcallahan.game_catalog_engine.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.config.GracefulShutdownConfig;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class RedisGameSearchCache implements GameSearchCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisGameSearchCache.class);
    private static final int SCAN_BATCH_SIZE = 500;

    private final JedisPooled jedisPooled;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    public RedisGameSearchCache(JedisPooled jedisPooled, ObjectMapper objectMapper, MetricsService metricsService) {
        this.jedisPooled = jedisPooled;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @Override
    public Optional<CachedGameIds> get(String key) {
        if (GracefulShutdownConfig.isShuttingDown()) {
            return Optional.empty();
        }
        try {
            String json = jedisPooled.get(key);
            if (json == null) {
                logger.debug("Redis cache MISS for key {}", key);
                return Optional.empty();
            }
            logger.debug("Redis cache HIT for key {}", key);
            return Optional.of(objectMapper.readValue(json, CachedGameIds.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            metricsService.incrementRedisError();
            logger.warn("Redis read failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, CachedGameIds value, Duration ttl) {
        if (GracefulShutdownConfig.isShuttingDown() || value.ids().isEmpty()) {
            return;
        }
        try {
            jedisPooled.setex(key, ttl.getSeconds(), objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize cache entry {}: {}", key, e.getMessage());
        } catch (RuntimeException e) {
            metricsService.incrementRedisError();
            logger.warn("Redis write failed for key {}: {}", key, e.getMessage());
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        if (GracefulShutdownConfig.isShuttingDown()) {
            return 0;
        }
        long deleted = 0;
        ScanParams params = new ScanParams().match(prefix + "*").count(SCAN_BATCH_SIZE);
        String cursor = ScanParams.SCAN_POINTER_START;
        try {
            do {
                ScanResult<String> page = jedisPooled.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    deleted += jedisPooled.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            logger.info("Deleted {} Redis keys with prefix {}", deleted, prefix);
        } catch (RuntimeException e) {
            metricsService.incrementRedisError();
            logger.warn("Redis delete by prefix {} failed after {} keys: {}", prefix, deleted, e.getMessage());
        }
        return deleted;
    }
}
