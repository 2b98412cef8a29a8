/**
 * Test for graceful shutdown handling
 * - Verifies executors are shut down on context close
 * - Verifies Redis connections are closed
 * - Verifies the shutdown flag stops cache traffic
 *
 * @author William Callahan
 */

package com.williamcallahan.game_catalog_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.service.cache.CachedGameIds;
import com.williamcallahan.game_catalog_engine.service.cache.RedisGameSearchCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownTest {

    @Mock
    private JedisPooled jedisPooled;

    @Mock
    private ThreadPoolTaskExecutor taskExecutor;

    @Mock
    private ThreadPoolTaskExecutor mvcTaskExecutor;

    @Mock
    private ApplicationContext applicationContext;

    @AfterEach
    void resetShutdownFlag() {
        GracefulShutdownConfig.resetShutdownFlag();
    }

    private GracefulShutdownConfig shutdownConfig() {
        GracefulShutdownConfig shutdownConfig = new GracefulShutdownConfig();
        ReflectionTestUtils.setField(shutdownConfig, "applicationContext", applicationContext);
        ReflectionTestUtils.setField(shutdownConfig, "taskExecutor", taskExecutor);
        ReflectionTestUtils.setField(shutdownConfig, "mvcTaskExecutor", mvcTaskExecutor);
        ReflectionTestUtils.setField(shutdownConfig, "jedisPooled", jedisPooled);
        return shutdownConfig;
    }

    @Test
    void testGracefulShutdown() {
        GracefulShutdownConfig shutdownConfig = shutdownConfig();
        when(taskExecutor.getActiveCount()).thenReturn(0);
        when(mvcTaskExecutor.getActiveCount()).thenReturn(0);

        assertFalse(GracefulShutdownConfig.isShuttingDown());

        shutdownConfig.onApplicationEvent(new ContextClosedEvent(applicationContext));

        assertTrue(GracefulShutdownConfig.isShuttingDown());
        verify(taskExecutor).shutdown();
        verify(mvcTaskExecutor).shutdown();
        verify(jedisPooled).close();
    }

    @Test
    void eventFromOtherContextIsIgnored() {
        GracefulShutdownConfig shutdownConfig = shutdownConfig();

        shutdownConfig.onApplicationEvent(new ContextClosedEvent(mock(ApplicationContext.class)));

        assertFalse(GracefulShutdownConfig.isShuttingDown());
        verifyNoInteractions(taskExecutor, mvcTaskExecutor, jedisPooled);
    }

    @Test
    void cacheStopsTouchingRedisOnceShutdownBegins() {
        when(taskExecutor.getActiveCount()).thenReturn(0);
        when(mvcTaskExecutor.getActiveCount()).thenReturn(0);
        shutdownConfig().onApplicationEvent(new ContextClosedEvent(applicationContext));
        RedisGameSearchCache cache = new RedisGameSearchCache(jedisPooled, new ObjectMapper(),
            mock(MetricsService.class));

        assertTrue(cache.get("igdb:search:halo").isEmpty());
        cache.put("igdb:search:halo", new CachedGameIds(List.of(1L), "upstream"), Duration.ofHours(1));
        assertEquals(0L, cache.deleteByPrefix("games:discover:"));

        verify(jedisPooled, never()).get(anyString());
        verify(jedisPooled, never()).setex(anyString(), anyLong(), anyString());
    }
}
