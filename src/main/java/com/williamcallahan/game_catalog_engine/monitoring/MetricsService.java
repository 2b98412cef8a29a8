/**
 * Service for tracking catalog search and sync metrics
 * Provides counters and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.game_catalog_engine.monitoring;

import com.williamcallahan.game_catalog_engine.dto.SearchSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import io.micrometer.core.instrument.Gauge;

@Service
public class MetricsService {

    private final Map<SearchSource, Counter> searchSourceCounters = new EnumMap<>(SearchSource.class);

    private final Counter redisErrors;
    private final Counter apiRateLimits;
    private final Counter tokenFetches;
    private final Counter tokenFetchFailures;
    private final Counter syncRuns;
    private final Counter syncSkipped;
    private final Counter syncFailedBatches;

    private final AtomicLong lastSyncCompletedAt = new AtomicLong(0);

    private final Timer upstreamCallTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        for (SearchSource source : SearchSource.values()) {
            searchSourceCounters.put(source, Counter.builder("games.search.source")
                .description("Search results served per layer")
                .tag("source", source.getTag())
                .register(meterRegistry));
        }

        this.redisErrors = Counter.builder("redis.errors")
            .description("Number of Redis operation errors")
            .register(meterRegistry);

        this.apiRateLimits = Counter.builder("igdb.rate_limits")
            .description("Number of IGDB 429 responses")
            .register(meterRegistry);

        this.tokenFetches = Counter.builder("igdb.token.fetches")
            .description("Number of access token requests sent to the identity provider")
            .register(meterRegistry);

        this.tokenFetchFailures = Counter.builder("igdb.token.failures")
            .description("Number of failed access token requests")
            .register(meterRegistry);

        this.syncRuns = Counter.builder("games.sync.runs")
            .description("Number of completed catalog syncs")
            .register(meterRegistry);

        this.syncSkipped = Counter.builder("games.sync.skipped")
            .description("Number of sync requests skipped because one was already running")
            .register(meterRegistry);

        this.syncFailedBatches = Counter.builder("games.sync.failed_batches")
            .description("Number of refresh batches that failed during a sync")
            .register(meterRegistry);

        Gauge.builder("games.sync.last_completed_timestamp", lastSyncCompletedAt, AtomicLong::get)
            .description("Epoch millis of the last completed catalog sync")
            .register(meterRegistry);

        this.upstreamCallTimer = Timer.builder("igdb.call.duration")
            .description("IGDB call duration")
            .register(meterRegistry);
    }

    public void recordSearchSource(SearchSource source) {
        searchSourceCounters.get(source).increment();
    }

    public void incrementRedisError() {
        redisErrors.increment();
    }

    public void incrementApiRateLimit() {
        apiRateLimits.increment();
    }

    public void incrementTokenFetch() {
        tokenFetches.increment();
    }

    public void incrementTokenFetchFailure() {
        tokenFetchFailures.increment();
    }

    public void recordSyncCompleted(int failedBatches) {
        syncRuns.increment();
        syncFailedBatches.increment(failedBatches);
        lastSyncCompletedAt.set(System.currentTimeMillis());
    }

    public void incrementSyncSkipped() {
        syncSkipped.increment();
    }

    public Timer.Sample startUpstreamTimer() {
        return Timer.start();
    }

    public void stopUpstreamTimer(Timer.Sample sample) {
        sample.stop(upstreamCallTimer);
    }
}
