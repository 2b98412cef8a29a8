package com.williamcallahan.game_catalog_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.GracefulShutdownConfig;
import com.williamcallahan.game_catalog_engine.dto.SyncResult;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import com.williamcallahan.game_catalog_engine.service.cache.GameSearchCache;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbApiClient;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbCredentialResolver;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbGameMapper;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbQueryBuilder;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbRetryController;
import com.williamcallahan.game_catalog_engine.util.SearchQueryUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Full catalog sync against IGDB.
 * <p>
 * Refresh phase: every stored game is re-fetched by IGDB id in small batches with a pause
 * between batches, each batch going through the retry controller. A failed batch is logged
 * and counted, and the sync moves on. Discovery phase: one query for well-rated multiplayer
 * games, upserted into the catalog. Browse-row cache entries are dropped afterwards whatever
 * the outcome.
 * <p>
 * Only one sync runs at a time; a call arriving while one is in progress returns a skipped
 * result immediately without contacting IGDB.
 */
@Service
@Slf4j
public class GameCatalogSynchronizer {

    private static final String IGDB_GAMES_ENDPOINT = "games";

    private final GameRepository gameRepository;
    private final IgdbApiClient igdbApiClient;
    private final IgdbRetryController retryController;
    private final IgdbQueryBuilder queryBuilder;
    private final IgdbGameMapper gameMapper;
    private final IgdbCredentialResolver credentialResolver;
    private final GameUpsertService upsertService;
    private final GameSearchCache searchCache;
    private final GameVisibilityFilter visibilityFilter;
    private final MetricsService metricsService;
    private final Executor executor;
    private final Sleeper sleeper;
    private final int batchSize;
    private final long batchDelayMs;

    private final AtomicBoolean syncInProgress = new AtomicBoolean(false);
    private volatile Instant lastSyncAt;
    private volatile SyncResult lastResult;

    @Autowired
    public GameCatalogSynchronizer(GameRepository gameRepository,
                                   IgdbApiClient igdbApiClient,
                                   IgdbRetryController retryController,
                                   IgdbQueryBuilder queryBuilder,
                                   IgdbGameMapper gameMapper,
                                   IgdbCredentialResolver credentialResolver,
                                   GameUpsertService upsertService,
                                   GameSearchCache searchCache,
                                   GameVisibilityFilter visibilityFilter,
                                   MetricsService metricsService,
                                   @Qualifier("taskExecutor") Executor executor,
                                   @Value("${app.igdb.sync.batch-size:10}") int batchSize,
                                   @Value("${app.igdb.sync.batch-delay-ms:250}") long batchDelayMs) {
        this(gameRepository, igdbApiClient, retryController, queryBuilder, gameMapper, credentialResolver,
            upsertService, searchCache, visibilityFilter, metricsService, executor, new ThreadWaitSleeper(),
            batchSize, batchDelayMs);
    }

    GameCatalogSynchronizer(GameRepository gameRepository,
                            IgdbApiClient igdbApiClient,
                            IgdbRetryController retryController,
                            IgdbQueryBuilder queryBuilder,
                            IgdbGameMapper gameMapper,
                            IgdbCredentialResolver credentialResolver,
                            GameUpsertService upsertService,
                            GameSearchCache searchCache,
                            GameVisibilityFilter visibilityFilter,
                            MetricsService metricsService,
                            Executor executor,
                            Sleeper sleeper,
                            int batchSize,
                            long batchDelayMs) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.gameRepository = gameRepository;
        this.igdbApiClient = igdbApiClient;
        this.retryController = retryController;
        this.queryBuilder = queryBuilder;
        this.gameMapper = gameMapper;
        this.credentialResolver = credentialResolver;
        this.upsertService = upsertService;
        this.searchCache = searchCache;
        this.visibilityFilter = visibilityFilter;
        this.metricsService = metricsService;
        this.executor = executor;
        this.sleeper = sleeper;
        this.batchSize = batchSize;
        this.batchDelayMs = batchDelayMs;
    }

    public SyncResult syncAll() {
        if (!syncInProgress.compareAndSet(false, true)) {
            log.info("Catalog sync already in progress; skipping");
            metricsService.incrementSyncSkipped();
            return SyncResult.skippedRun();
        }
        try {
            if (!credentialResolver.isConfigured()) {
                log.info("IGDB not configured; catalog sync has nothing to do");
                return SyncResult.empty();
            }
            log.info("Starting catalog sync");
            long started = System.currentTimeMillis();

            RefreshOutcome refresh = refreshExistingGames();
            int discovered = 0;
            int failedBatches = refresh.failedBatches();
            if (!refresh.interrupted() && !GracefulShutdownConfig.isShuttingDown()) {
                try {
                    discovered = discoverGames();
                } catch (RuntimeException e) {
                    failedBatches++;
                    log.warn("Discovery query failed: {}", e.getMessage());
                }
            }

            SyncResult result = new SyncResult(refresh.refreshed(), discovered, failedBatches, false);
            lastResult = result;
            lastSyncAt = Instant.now();
            metricsService.recordSyncCompleted(failedBatches);
            log.info("Catalog sync finished in {}ms: refreshed={}, discovered={}, failedBatches={}",
                System.currentTimeMillis() - started, result.refreshedCount(), result.discoveredCount(),
                result.failedBatches());
            return result;
        } finally {
            searchCache.deleteByPrefix(SearchQueryUtils.DISCOVER_KEY_PREFIX);
            syncInProgress.set(false);
        }
    }

    /**
     * Runs {@link #syncAll()} on the task executor. Reports a skipped run when the executor
     * no longer accepts work.
     */
    public CompletableFuture<SyncResult> syncAllAsync() {
        try {
            return CompletableFuture.supplyAsync(this::syncAll, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Catalog sync not started: {}", e.getMessage());
            return CompletableFuture.completedFuture(SyncResult.skippedRun());
        }
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    public Instant getLastSyncAt() {
        return lastSyncAt;
    }

    public SyncResult getLastResult() {
        return lastResult;
    }

    private record RefreshOutcome(int refreshed, int failedBatches, boolean interrupted) {
    }

    private RefreshOutcome refreshExistingGames() {
        long cursor = 0;
        int refreshed = 0;
        int failedBatches = 0;
        boolean firstBatch = true;

        while (true) {
            if (GracefulShutdownConfig.isShuttingDown()) {
                log.info("Shutdown in progress; stopping catalog refresh after {} games", refreshed);
                return new RefreshOutcome(refreshed, failedBatches, true);
            }
            List<Long> igdbIds = gameRepository.findIgdbIdsAfter(cursor, batchSize);
            if (igdbIds.isEmpty()) {
                break;
            }
            cursor = igdbIds.get(igdbIds.size() - 1);

            if (!firstBatch && !pauseBetweenBatches()) {
                return new RefreshOutcome(refreshed, failedBatches, true);
            }
            firstBatch = false;

            try {
                List<JsonNode> nodes = retryController.withRetry(
                    () -> igdbApiClient.query(IGDB_GAMES_ENDPOINT, queryBuilder.byIds(igdbIds)));
                List<Game> games = gameMapper.toGames(nodes);
                refreshed += upsertService.upsertGames(games).size();
            } catch (RuntimeException e) {
                failedBatches++;
                log.warn("Refresh batch ending at igdb id {} failed: {}", cursor, e.getMessage());
            }

            if (igdbIds.size() < batchSize) {
                break;
            }
        }
        return new RefreshOutcome(refreshed, failedBatches, false);
    }

    private int discoverGames() {
        List<JsonNode> nodes = retryController.withRetry(
            () -> igdbApiClient.query(IGDB_GAMES_ENDPOINT, queryBuilder.discovery(visibilityFilter.excludeAdult())));
        List<Game> games = gameMapper.toGames(nodes);
        return upsertService.upsertGames(games).size();
    }

    private boolean pauseBetweenBatches() {
        if (batchDelayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(batchDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Catalog refresh interrupted between batches");
            return false;
        }
    }
}
