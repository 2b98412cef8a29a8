package com.williamcallahan.game_catalog_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.model.GameVideo;
import com.williamcallahan.game_catalog_engine.model.PlayerCount;
import com.williamcallahan.game_catalog_engine.util.SearchQueryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Postgres access for the {@code games} table.
 * <p>
 * Every read that serves end users takes an {@code excludeAdult} flag and applies the
 * visibility predicate: hidden and banned rows are always excluded, adult-themed rows
 * only when the flag is set. Failures propagate as Spring {@code DataAccessException}s.
 */
@Repository
public class GameRepository {

    private static final Logger log = LoggerFactory.getLogger(GameRepository.class);
    private static final TypeReference<List<GameVideo>> VIDEO_LIST = new TypeReference<>() {};

    private static final String UPSERT_COLUMNS = """
        igdb_id, name, slug, cover_url, genres, themes, platforms, game_modes, summary, rating,
        aggregated_rating, popularity, first_release_date, player_count_min, player_count_max,
        twitch_game_id, crossplay, screenshots, videos""";

    private static final String UPSERT_VALUES_ROW =
        "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)";

    // hidden and banned belong to moderation and are never updated here
    private static final String UPSERT_UPDATE = """
        ON CONFLICT (igdb_id) DO UPDATE SET
            name = EXCLUDED.name,
            slug = EXCLUDED.slug,
            cover_url = EXCLUDED.cover_url,
            genres = EXCLUDED.genres,
            themes = EXCLUDED.themes,
            platforms = EXCLUDED.platforms,
            game_modes = EXCLUDED.game_modes,
            summary = EXCLUDED.summary,
            rating = EXCLUDED.rating,
            aggregated_rating = EXCLUDED.aggregated_rating,
            popularity = EXCLUDED.popularity,
            first_release_date = EXCLUDED.first_release_date,
            player_count_min = EXCLUDED.player_count_min,
            player_count_max = EXCLUDED.player_count_max,
            twitch_game_id = EXCLUDED.twitch_game_id,
            crossplay = EXCLUDED.crossplay,
            screenshots = EXCLUDED.screenshots,
            videos = EXCLUDED.videos,
            cached_at = now()
        RETURNING *""";

    /**
     * Browse rows served from the durable store.
     */
    public enum DiscoveryQuery {
        POPULAR("popularity IS NOT NULL", "popularity DESC"),
        TOP_RATED("aggregated_rating IS NOT NULL", "aggregated_rating DESC"),
        MULTIPLAYER("game_modes && ARRAY[2,3,5]", "rating DESC NULLS LAST"),
        RECENT("first_release_date IS NOT NULL AND first_release_date <= now()", "first_release_date DESC");

        private final String condition;
        private final String ordering;

        DiscoveryQuery(String condition, String ordering) {
            this.condition = condition;
            this.ordering = ordering;
        }
    }

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Game> gameRowMapper = new GameRowMapper();

    public GameRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * SQL predicate selecting rows an end user may see.
     */
    public static String visibilityPredicate(boolean excludeAdult) {
        String base = "hidden = false AND banned = false";
        return excludeAdult ? base + " AND NOT (themes && ARRAY[" + Game.ADULT_THEME_ID + "])" : base;
    }

    // ==================== Reads ====================

    /**
     * Case-insensitive substring match on name. LIKE metacharacters in the query are literal.
     */
    public List<Game> searchVisibleByName(String query, boolean excludeAdult, int limit) {
        String sql = "SELECT * FROM games WHERE name ILIKE ? ESCAPE '\\' AND " + visibilityPredicate(excludeAdult)
            + " ORDER BY popularity DESC NULLS LAST, name LIMIT ?";
        return jdbcTemplate.query(sql, gameRowMapper, SearchQueryUtils.likeContainsPattern(query), limit);
    }

    /**
     * Visible games for the given local ids, in the order the ids were given.
     * Ids that no longer exist or are no longer visible are skipped.
     */
    public List<Game> findVisibleByIds(List<Long> ids, boolean excludeAdult) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM games WHERE id = ANY(?) AND " + visibilityPredicate(excludeAdult);
        List<Game> rows = jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setArray(1, con.createArrayOf("bigint", ids.toArray()));
            return ps;
        }, gameRowMapper);

        Map<Long, Game> byId = new HashMap<>();
        for (Game game : rows) {
            byId.put(game.getId(), game);
        }
        List<Game> ordered = new ArrayList<>(rows.size());
        for (Long id : ids) {
            Game game = byId.remove(id);
            if (game != null) {
                ordered.add(game);
            }
        }
        return ordered;
    }

    public Optional<Game> findVisibleById(long id, boolean excludeAdult) {
        String sql = "SELECT * FROM games WHERE id = ? AND " + visibilityPredicate(excludeAdult);
        return jdbcTemplate.query(sql, gameRowMapper, id).stream().findFirst();
    }

    /**
     * Unfiltered lookup for moderation.
     */
    public Optional<Game> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM games WHERE id = ?", gameRowMapper, id).stream().findFirst();
    }

    public Optional<Game> findByIgdbId(long igdbId) {
        return jdbcTemplate.query("SELECT * FROM games WHERE igdb_id = ?", gameRowMapper, igdbId).stream().findFirst();
    }

    public List<Game> findDiscoveryRow(DiscoveryQuery query, boolean excludeAdult, int limit) {
        String sql = "SELECT * FROM games WHERE " + query.condition + " AND " + visibilityPredicate(excludeAdult)
            + " ORDER BY " + query.ordering + ", id LIMIT ?";
        return jdbcTemplate.query(sql, gameRowMapper, limit);
    }

    /**
     * Keyset page of IGDB ids in ascending order, starting after {@code afterIgdbId}.
     * Moderated games are included so their metadata stays current.
     */
    public List<Long> findIgdbIdsAfter(long afterIgdbId, int limit) {
        return jdbcTemplate.queryForList(
            "SELECT igdb_id FROM games WHERE igdb_id > ? ORDER BY igdb_id LIMIT ?", Long.class, afterIgdbId, limit);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM games", Long.class);
        return count == null ? 0 : count;
    }

    // ==================== Writes ====================

    /**
     * Inserts or updates all games in one statement keyed on igdb_id.
     * When the input repeats an igdb_id the last occurrence wins.
     *
     * @return the stored rows, including local ids and preserved moderation flags
     */
    public List<Game> upsertAll(Collection<Game> games) {
        if (games == null || games.isEmpty()) {
            return List.of();
        }
        Map<Long, Game> unique = new LinkedHashMap<>();
        for (Game game : games) {
            unique.remove(game.getIgdbId());
            unique.put(game.getIgdbId(), game);
        }
        List<Game> batch = new ArrayList<>(unique.values());
        if (batch.size() < games.size()) {
            log.debug("Collapsed {} duplicate igdb ids before upsert", games.size() - batch.size());
        }

        StringBuilder sql = new StringBuilder("INSERT INTO games (").append(UPSERT_COLUMNS).append(") VALUES ");
        for (int i = 0; i < batch.size(); i++) {
            sql.append(i == 0 ? "" : ", ").append(UPSERT_VALUES_ROW);
        }
        sql.append(' ').append(UPSERT_UPDATE);

        PreparedStatementCreator creator = con -> {
            PreparedStatement ps = con.prepareStatement(sql.toString());
            int index = 1;
            for (Game game : batch) {
                index = bindUpsertRow(con, ps, index, game);
            }
            return ps;
        };
        return jdbcTemplate.query(creator, gameRowMapper);
    }

    public int updateHidden(long id, boolean hidden) {
        return jdbcTemplate.update("UPDATE games SET hidden = ? WHERE id = ?", hidden, id);
    }

    public int updateBanned(long id, boolean banned) {
        return jdbcTemplate.update("UPDATE games SET banned = ? WHERE id = ?", banned, id);
    }

    /**
     * Hides every visible game tagged with the adult theme.
     *
     * @return number of rows hidden
     */
    public int hideAdultThemed() {
        return jdbcTemplate.update(
            "UPDATE games SET hidden = true WHERE hidden = false AND themes && ARRAY[" + Game.ADULT_THEME_ID + "]");
    }

    private int bindUpsertRow(Connection con, PreparedStatement ps, int start, Game game) throws SQLException {
        int i = start;
        ps.setLong(i++, game.getIgdbId());
        ps.setString(i++, game.getName());
        ps.setString(i++, game.getSlug());
        ps.setString(i++, game.getCoverUrl());
        ps.setArray(i++, intArray(con, game.getGenres()));
        ps.setArray(i++, intArray(con, game.getThemes()));
        ps.setArray(i++, intArray(con, game.getPlatforms()));
        ps.setArray(i++, intArray(con, game.getGameModes()));
        ps.setString(i++, game.getSummary());
        setDouble(ps, i++, game.getRating());
        setDouble(ps, i++, game.getAggregatedRating());
        setDouble(ps, i++, game.getPopularity());
        if (game.getFirstReleaseDate() != null) {
            ps.setTimestamp(i++, Timestamp.from(game.getFirstReleaseDate()));
        } else {
            ps.setNull(i++, Types.TIMESTAMP_WITH_TIMEZONE);
        }
        PlayerCount playerCount = game.getPlayerCount();
        setInteger(ps, i++, playerCount == null ? null : playerCount.min());
        setInteger(ps, i++, playerCount == null ? null : playerCount.max());
        ps.setString(i++, game.getTwitchGameId());
        if (game.getCrossplay() != null) {
            ps.setBoolean(i++, game.getCrossplay());
        } else {
            ps.setNull(i++, Types.BOOLEAN);
        }
        List<String> screenshots = game.getScreenshots() == null ? List.of() : game.getScreenshots();
        ps.setArray(i++, con.createArrayOf("text", screenshots.toArray()));
        ps.setString(i++, writeVideos(game.getVideos()));
        return i;
    }

    private static Array intArray(Connection con, List<Integer> values) throws SQLException {
        return con.createArrayOf("integer", values == null ? new Object[0] : values.toArray());
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private String writeVideos(List<GameVideo> videos) {
        try {
            return objectMapper.writeValueAsString(videos == null ? List.of() : videos);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize game videos", e);
        }
    }

    private List<GameVideo> readVideos(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, VIDEO_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable videos column: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private final class GameRowMapper implements RowMapper<Game> {
        @Override
        public Game mapRow(@NonNull ResultSet rs, int rowNum) throws SQLException {
            Game game = new Game();
            game.setId(rs.getLong("id"));
            game.setIgdbId(rs.getLong("igdb_id"));
            game.setName(rs.getString("name"));
            game.setSlug(rs.getString("slug"));
            game.setCoverUrl(rs.getString("cover_url"));
            game.setGenres(readIntArray(rs, "genres"));
            game.setThemes(readIntArray(rs, "themes"));
            game.setPlatforms(readIntArray(rs, "platforms"));
            game.setGameModes(readIntArray(rs, "game_modes"));
            game.setSummary(rs.getString("summary"));
            game.setRating(rs.getObject("rating", Double.class));
            game.setAggregatedRating(rs.getObject("aggregated_rating", Double.class));
            game.setPopularity(rs.getObject("popularity", Double.class));
            game.setFirstReleaseDate(toInstant(rs.getTimestamp("first_release_date")));
            Integer min = rs.getObject("player_count_min", Integer.class);
            Integer max = rs.getObject("player_count_max", Integer.class);
            if (min != null && max != null) {
                game.setPlayerCount(new PlayerCount(min, max));
            }
            game.setTwitchGameId(rs.getString("twitch_game_id"));
            game.setCrossplay(rs.getObject("crossplay", Boolean.class));
            game.setScreenshots(readTextArray(rs, "screenshots"));
            game.setVideos(readVideos(rs.getString("videos")));
            game.setHidden(rs.getBoolean("hidden"));
            game.setBanned(rs.getBoolean("banned"));
            game.setCachedAt(toInstant(rs.getTimestamp("cached_at")));
            return game;
        }

        private List<Integer> readIntArray(ResultSet rs, String column) throws SQLException {
            Array array = rs.getArray(column);
            if (array == null) {
                return new ArrayList<>();
            }
            List<Integer> values = new ArrayList<>();
            for (Object value : (Object[]) array.getArray()) {
                if (value instanceof Number number) {
                    values.add(number.intValue());
                }
            }
            return values;
        }

        private List<String> readTextArray(ResultSet rs, String column) throws SQLException {
            Array array = rs.getArray(column);
            if (array == null) {
                return new ArrayList<>();
            }
            List<String> values = new ArrayList<>();
            for (Object value : (Object[]) array.getArray()) {
                if (value != null) {
                    values.add(value.toString());
                }
            }
            return values;
        }

        private Instant toInstant(Timestamp timestamp) {
            return timestamp == null ? null : timestamp.toInstant();
        }
    }
}
