package com.williamcallahan.game_catalog_engine.service.igdb;

import com.williamcallahan.game_catalog_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries IGDB calls that were rate limited, with exponential backoff.
 * <p>
 * Attempt {@code n} that fails with HTTP 429 is followed by a wait of
 * {@code baseDelay * 2^(n-1)}. After {@code maxAttempts} rate-limited attempts an
 * {@link IgdbRetryExhaustedException} is thrown. Every other failure propagates at once.
 */
@Component
@Slf4j
public class IgdbRetryController {

    private final Sleeper sleeper;
    private final int defaultMaxAttempts;
    private final long defaultBaseDelayMs;

    @Autowired
    public IgdbRetryController(@Value("${app.igdb.retry.max-attempts:3}") int defaultMaxAttempts,
                               @Value("${app.igdb.retry.base-delay-ms:1000}") long defaultBaseDelayMs) {
        this(new ThreadWaitSleeper(), defaultMaxAttempts, defaultBaseDelayMs);
    }

    public IgdbRetryController(Sleeper sleeper, int defaultMaxAttempts, long defaultBaseDelayMs) {
        this.sleeper = sleeper;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultBaseDelayMs = defaultBaseDelayMs;
    }

    public <T> T withRetry(Supplier<T> operation) {
        return withRetry(operation, defaultMaxAttempts, defaultBaseDelayMs);
    }

    public <T> T withRetry(Supplier<T> operation, int maxAttempts, long baseDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        IgdbRateLimitedException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (IgdbRateLimitedException e) {
                lastFailure = e;
                long delay = baseDelayMs * (1L << (attempt - 1));
                ExternalApiLogger.logRateLimited(log, "IGDB", attempt, maxAttempts, delay);
                sleep(delay);
            }
        }
        throw new IgdbRetryExhaustedException(maxAttempts, lastFailure);
    }

    private void sleep(long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during IGDB rate-limit backoff", e);
        }
    }
}
