package com.williamcallahan.game_catalog_engine.service.igdb;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IgdbRetryControllerTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final IgdbRetryController retryController = new IgdbRetryController(sleeps::add, 3, 1000L);

    @Test
    void withRetry_returnsImmediatelyOnSuccess() {
        assertThat(retryController.withRetry(() -> "ok")).isEqualTo("ok");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void withRetry_backsOffExponentiallyThenGivesUp() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryController.withRetry(() -> {
            calls.incrementAndGet();
            throw new IgdbRateLimitedException();
        }))
            .isInstanceOf(IgdbRetryExhaustedException.class)
            .hasCauseInstanceOf(IgdbRateLimitedException.class);

        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(1000L, 2000L, 4000L);
    }

    @Test
    void withRetry_succeedsAfterRateLimitedAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryController.withRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IgdbRateLimitedException();
            }
            return "second";
        });

        assertThat(result).isEqualTo("second");
        assertThat(sleeps).containsExactly(1000L);
    }

    @Test
    void withRetry_doesNotRetryOtherFailures() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryController.withRetry(() -> {
            calls.incrementAndGet();
            throw new IgdbUpstreamException("IGDB returned HTTP 500", 500);
        })).isInstanceOf(IgdbUpstreamException.class);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void withRetry_honorsExplicitAttemptsAndDelay() {
        assertThatThrownBy(() -> retryController.withRetry(() -> {
            throw new IgdbRateLimitedException();
        }, 2, 50L)).isInstanceOf(IgdbRetryExhaustedException.class);

        assertThat(sleeps).containsExactly(50L, 100L);
    }
}
