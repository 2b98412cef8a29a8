package com.williamcallahan.game_catalog_engine.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisHealthIndicatorTest {

    @Mock
    private JedisPooled jedisPooled;

    @InjectMocks
    private RedisHealthIndicator indicator;

    @Test
    void health_upOnPong() {
        when(jedisPooled.ping()).thenReturn("PONG");

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void health_unknownUntilFailuresReachThreshold() {
        when(jedisPooled.ping()).thenThrow(new JedisConnectionException("refused"));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void health_successResetsFailureCount() {
        when(jedisPooled.ping())
            .thenThrow(new JedisConnectionException("refused"))
            .thenThrow(new JedisConnectionException("refused"))
            .thenReturn("PONG")
            .thenThrow(new JedisConnectionException("refused"));

        indicator.health();
        indicator.health();
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }
}
