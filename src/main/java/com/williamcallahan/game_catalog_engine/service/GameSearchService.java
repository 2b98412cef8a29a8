package com.williamcallahan.game_catalog_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.dto.GameDetail;
import com.williamcallahan.game_catalog_engine.dto.GameSearchResult;
import com.williamcallahan.game_catalog_engine.dto.SearchSource;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import com.williamcallahan.game_catalog_engine.service.cache.CachedGameIds;
import com.williamcallahan.game_catalog_engine.service.cache.GameSearchCache;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbApiClient;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbGameMapper;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbNotConfiguredException;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbQueryBuilder;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbRetryController;
import com.williamcallahan.game_catalog_engine.util.ExternalApiLogger;
import com.williamcallahan.game_catalog_engine.util.SearchQueryUtils;
import com.williamcallahan.game_catalog_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layered game search.
 * <p>
 * ARCHITECTURE:
 * 1. FAST CACHE: Redis holds id lists per normalized query; hits are re-read from Postgres
 *    through the visibility filter so moderation takes effect immediately
 * 2. DURABLE STORE: Postgres name search; non-empty results populate the fast cache
 * 3. UPSTREAM: IGDB through the retry controller; results are upserted, re-read and cached
 * 4. DEGRADED LOCAL: when IGDB cannot answer, the Postgres search result is returned as is
 * <p>
 * Empty results are never cached. Upstream failures never reach the caller; only a
 * database failure does.
 */
@Service
public class GameSearchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GameSearchService.class);
    private static final String IGDB_GAMES_ENDPOINT = "games";

    private final GameRepository gameRepository;
    private final GameSearchCache searchCache;
    private final IgdbApiClient igdbApiClient;
    private final IgdbRetryController retryController;
    private final IgdbQueryBuilder queryBuilder;
    private final IgdbGameMapper gameMapper;
    private final GameUpsertService upsertService;
    private final GameVisibilityFilter visibilityFilter;
    private final GameDetailMapper detailMapper;
    private final MetricsService metricsService;
    private final Duration searchTtl;
    private final int searchLimit;

    public GameSearchService(GameRepository gameRepository,
                             GameSearchCache searchCache,
                             IgdbApiClient igdbApiClient,
                             IgdbRetryController retryController,
                             IgdbQueryBuilder queryBuilder,
                             IgdbGameMapper gameMapper,
                             GameUpsertService upsertService,
                             GameVisibilityFilter visibilityFilter,
                             GameDetailMapper detailMapper,
                             MetricsService metricsService,
                             IgdbConfigurationProperties igdbProperties,
                             @Value("${app.cache.search.ttl:24h}") String searchTtl) {
        this.gameRepository = gameRepository;
        this.searchCache = searchCache;
        this.igdbApiClient = igdbApiClient;
        this.retryController = retryController;
        this.queryBuilder = queryBuilder;
        this.gameMapper = gameMapper;
        this.upsertService = upsertService;
        this.visibilityFilter = visibilityFilter;
        this.detailMapper = detailMapper;
        this.metricsService = metricsService;
        this.searchTtl = DurationStyle.detectAndParse(searchTtl);
        this.searchLimit = igdbProperties.getSearchLimit();
    }

    /**
     * @throws IllegalArgumentException when the query is blank
     */
    public GameSearchResult searchGames(String query) {
        if (!ValidationUtils.hasText(query)) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        String term = query.trim();
        String cacheKey = SearchQueryUtils.searchCacheKey(term);
        boolean excludeAdult = visibilityFilter.excludeAdult();

        Optional<CachedGameIds> cached = searchCache.get(cacheKey);
        if (cached.isPresent()) {
            List<Game> revalidated = gameRepository.findVisibleByIds(cached.get().ids(), excludeAdult);
            ExternalApiLogger.logTieredSearchLayer(LOGGER, term, "FAST-CACHE", revalidated.size());
            return result(revalidated, true, SearchSource.FAST_CACHE);
        }

        List<Game> stored = gameRepository.searchVisibleByName(term, excludeAdult, searchLimit);
        if (!stored.isEmpty()) {
            ExternalApiLogger.logTieredSearchLayer(LOGGER, term, "DURABLE-STORE", stored.size());
            searchCache.put(cacheKey, new CachedGameIds(ids(stored), SearchSource.DURABLE_STORE.getTag()), searchTtl);
            return result(stored, true, SearchSource.DURABLE_STORE);
        }

        try {
            return searchUpstream(term, cacheKey, excludeAdult);
        } catch (IgdbNotConfiguredException e) {
            ExternalApiLogger.logFallback(LOGGER, term, "IGDB not configured");
        } catch (RuntimeException e) {
            ExternalApiLogger.logFallback(LOGGER, term, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        List<GameDetail> local = searchLocalGames(term);
        metricsService.recordSearchSource(SearchSource.DEGRADED_LOCAL);
        return new GameSearchResult(local, true, SearchSource.DEGRADED_LOCAL);
    }

    /**
     * Postgres-only search with the visibility filter applied. Never contacts IGDB; this is
     * the degraded layer of {@link #searchGames(String)}.
     */
    public List<GameDetail> searchLocalGames(String query) {
        if (!ValidationUtils.hasText(query)) {
            return List.of();
        }
        return detailMapper.toDetails(
            gameRepository.searchVisibleByName(query.trim(), visibilityFilter.excludeAdult(), searchLimit));
    }

    /**
     * @return empty when the game does not exist or is not visible
     */
    public Optional<GameDetail> getGameById(long id) {
        return gameRepository.findVisibleById(id, visibilityFilter.excludeAdult()).map(detailMapper::toDetail);
    }

    public Optional<GameDetail> getGameByIgdbId(long igdbId) {
        boolean excludeAdult = visibilityFilter.excludeAdult();
        return gameRepository.findByIgdbId(igdbId)
            .filter(game -> visibilityFilter.isVisible(game, excludeAdult))
            .map(detailMapper::toDetail);
    }

    private GameSearchResult searchUpstream(String term, String cacheKey, boolean excludeAdult) {
        List<JsonNode> nodes = retryController.withRetry(
            () -> igdbApiClient.query(IGDB_GAMES_ENDPOINT, queryBuilder.search(term, excludeAdult)));
        List<Game> fetched = gameMapper.toGames(nodes);
        if (fetched.isEmpty()) {
            ExternalApiLogger.logTieredSearchLayer(LOGGER, term, "UPSTREAM", 0);
            return result(List.of(), false, SearchSource.UPSTREAM);
        }

        List<Game> upserted = upsertService.upsertGames(fetched);
        Map<Long, Long> localIdByIgdbId = new HashMap<>();
        for (Game game : upserted) {
            localIdByIgdbId.put(game.getIgdbId(), game.getId());
        }
        List<Long> orderedIds = new ArrayList<>();
        for (Game game : fetched) {
            Long localId = localIdByIgdbId.remove(game.getIgdbId());
            if (localId != null) {
                orderedIds.add(localId);
            }
        }

        List<Game> visible = gameRepository.findVisibleByIds(orderedIds, excludeAdult);
        if (!visible.isEmpty()) {
            searchCache.put(cacheKey, new CachedGameIds(ids(visible), SearchSource.UPSTREAM.getTag()), searchTtl);
        }
        ExternalApiLogger.logTieredSearchLayer(LOGGER, term, "UPSTREAM", visible.size());
        return result(visible, false, SearchSource.UPSTREAM);
    }

    private GameSearchResult result(List<Game> games, boolean cached, SearchSource source) {
        metricsService.recordSearchSource(source);
        return new GameSearchResult(detailMapper.toDetails(games), cached, source);
    }

    private static List<Long> ids(List<Game> games) {
        return games.stream().map(Game::getId).toList();
    }
}
