/**
 * Redis configuration for the game search fast cache using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts either a REDIS_SERVER url (redis:// or rediss://) or host/port properties
 * - Pool sizing driven by spring.redis.jedis.pool.*
 * - Pings on startup so a misconfigured endpoint fails fast
 */

package com.williamcallahan.game_catalog_engine.config;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

@Configuration
@Conditional(RedisEnvironmentCondition.class)
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);
    private static final int DEFAULT_PORT = 6379;

    @Value("${spring.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.redis.port:6379}")
    private int redisPort;

    @Value("${spring.redis.password:#{null}}")
    private String redisPassword;

    @Value("${REDIS_SERVER:#{null}}")
    private String redisUrl;

    @Value("${spring.redis.ssl:false}")
    private boolean useSsl;

    @Value("${spring.redis.timeout:5000}")
    private int timeout;

    @Value("${spring.redis.jedis.pool.max-active:16}")
    private int maxActive;

    @Value("${spring.redis.jedis.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.redis.jedis.pool.min-idle:1}")
    private int minIdle;

    @Value("${spring.redis.jedis.pool.max-wait:2000}")
    private int maxWait;

    /**
     * Pooled client shared by the fast cache and the health indicator.
     * Closing is left to GracefulShutdownConfig.
     */
    @Bean
    public JedisPooled jedisPooled() {
        HostAndPort hostAndPort = resolveHostAndPort();
        DefaultJedisClientConfig clientConfig = buildClientConfig();
        GenericObjectPoolConfig<Connection> poolConfig = buildPoolConfig();

        logger.info("Creating JedisPooled: host={}, port={}, maxTotal={}, ssl={}",
            hostAndPort.getHost(), hostAndPort.getPort(), poolConfig.getMaxTotal(), clientConfig.isSsl());

        JedisPooled jedis = new JedisPooled(hostAndPort, clientConfig, poolConfig);
        try {
            logger.info("Redis ping on startup: {}", jedis.ping());
        } catch (Exception e) {
            jedis.close();
            throw new IllegalStateException("Failed to ping Redis during startup: " + e.getMessage(), e);
        }
        return jedis;
    }

    private HostAndPort resolveHostAndPort() {
        if (redisUrl == null || redisUrl.isBlank()) {
            return new HostAndPort(redisHost, redisPort);
        }
        try {
            URI uri = new URI(redisUrl);
            return new HostAndPort(uri.getHost(), uri.getPort() != -1 ? uri.getPort() : DEFAULT_PORT);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid Redis URL: " + maskCredentials(redisUrl), e);
        }
    }

    private DefaultJedisClientConfig buildClientConfig() {
        DefaultJedisClientConfig.Builder builder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout);

        String password = resolvePassword();
        if (password != null && !password.isEmpty()) {
            builder.password(password);
        }
        if (useSsl || (redisUrl != null && redisUrl.startsWith("rediss://"))) {
            builder.ssl(true);
        }
        return builder.build();
    }

    private String resolvePassword() {
        if (redisUrl != null && !redisUrl.isBlank()) {
            try {
                String userInfo = new URI(redisUrl).getUserInfo();
                if (userInfo != null) {
                    String[] parts = userInfo.split(":", 2);
                    if (parts.length > 1) {
                        return parts[1];
                    }
                }
            } catch (URISyntaxException e) {
                logger.warn("Failed to parse Redis URL for password: {}", e.getMessage());
            }
        }
        return redisPassword;
    }

    private GenericObjectPoolConfig<Connection> buildPoolConfig() {
        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(maxWait));
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(60));
        poolConfig.setMinEvictableIdleDuration(Duration.ofSeconds(120));
        return poolConfig;
    }

    private String maskCredentials(String url) {
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at > 0 && scheme > 0 && at > scheme) {
            return url.substring(0, scheme + 3) + "******" + url.substring(at);
        }
        return url;
    }
}
