package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.dto.DiscoveryRow;
import com.williamcallahan.game_catalog_engine.dto.SearchSource;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import com.williamcallahan.game_catalog_engine.repository.GameRepository.DiscoveryQuery;
import com.williamcallahan.game_catalog_engine.service.cache.CachedGameIds;
import com.williamcallahan.game_catalog_engine.service.cache.GameSearchCache;
import com.williamcallahan.game_catalog_engine.util.SearchQueryUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Browse rows for the games landing page. Row id lists are cached under
 * {@code games:discover:<slug>} and re-read through the visibility filter on every request.
 * A completed catalog sync drops all of them.
 */
@Service
@Slf4j
public class GameDiscoveryService {

    private record RowDefinition(String slug, String title, DiscoveryQuery query) {
    }

    private static final List<RowDefinition> ROWS = List.of(
        new RowDefinition("popular", "Popular Games", DiscoveryQuery.POPULAR),
        new RowDefinition("top-rated", "Top Rated", DiscoveryQuery.TOP_RATED),
        new RowDefinition("multiplayer", "Multiplayer", DiscoveryQuery.MULTIPLAYER),
        new RowDefinition("recent", "Recent Releases", DiscoveryQuery.RECENT)
    );

    private final GameRepository gameRepository;
    private final GameSearchCache searchCache;
    private final GameVisibilityFilter visibilityFilter;
    private final GameDetailMapper detailMapper;
    private final Duration rowTtl;
    private final int rowSize;

    public GameDiscoveryService(GameRepository gameRepository,
                                GameSearchCache searchCache,
                                GameVisibilityFilter visibilityFilter,
                                GameDetailMapper detailMapper,
                                @Value("${app.cache.discover.ttl:1h}") String rowTtl,
                                @Value("${app.games.discover.row-size:20}") int rowSize) {
        this.gameRepository = gameRepository;
        this.searchCache = searchCache;
        this.visibilityFilter = visibilityFilter;
        this.detailMapper = detailMapper;
        this.rowTtl = DurationStyle.detectAndParse(rowTtl);
        this.rowSize = rowSize;
    }

    /**
     * @return non-empty rows in display order
     */
    public List<DiscoveryRow> getDiscoveryRows() {
        boolean excludeAdult = visibilityFilter.excludeAdult();
        List<DiscoveryRow> rows = new ArrayList<>(ROWS.size());
        for (RowDefinition definition : ROWS) {
            List<Game> games = loadRow(definition, excludeAdult);
            if (!games.isEmpty()) {
                rows.add(new DiscoveryRow(definition.slug(), definition.title(), detailMapper.toDetails(games)));
            }
        }
        return rows;
    }

    private List<Game> loadRow(RowDefinition definition, boolean excludeAdult) {
        String key = SearchQueryUtils.discoverCacheKey(definition.slug());
        Optional<CachedGameIds> cached = searchCache.get(key);
        if (cached.isPresent()) {
            return gameRepository.findVisibleByIds(cached.get().ids(), excludeAdult);
        }
        List<Game> games = gameRepository.findDiscoveryRow(definition.query(), excludeAdult, rowSize);
        if (!games.isEmpty()) {
            List<Long> ids = games.stream().map(Game::getId).toList();
            searchCache.put(key, new CachedGameIds(ids, SearchSource.DURABLE_STORE.getTag()), rowTtl);
        }
        log.debug("Discovery row {} loaded {} games from Postgres", definition.slug(), games.size());
        return games;
    }
}
