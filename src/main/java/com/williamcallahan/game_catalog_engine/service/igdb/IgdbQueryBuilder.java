package com.williamcallahan.game_catalog_engine.service.igdb;

import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.util.SearchQueryUtils;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Builds APIcalypse request bodies for the {@code games} endpoint.
 */
@Component
public class IgdbQueryBuilder {

    public static final int DISCOVERY_LIMIT = 100;

    static final String GAME_FIELDS = String.join(", ",
        "name", "slug", "cover.image_id",
        "genres", "themes", "platforms", "game_modes",
        "summary", "rating", "aggregated_rating", "total_rating", "total_rating_count", "hypes",
        "first_release_date",
        "screenshots.image_id", "videos.name", "videos.video_id",
        "multiplayer_modes.platform", "multiplayer_modes.onlinemax", "multiplayer_modes.offlinemax",
        "multiplayer_modes.onlinecoop",
        "external_games.category", "external_games.uid");

    private final int searchLimit;

    public IgdbQueryBuilder(IgdbConfigurationProperties properties) {
        this.searchLimit = properties.getSearchLimit();
    }

    public String search(String term, boolean excludeAdult) {
        StringBuilder body = new StringBuilder()
            .append("search \"").append(SearchQueryUtils.escapeIgdbString(term.trim())).append("\"; ")
            .append("fields ").append(GAME_FIELDS).append("; ");
        if (excludeAdult) {
            body.append("where ").append(adultFilter()).append("; ");
        }
        return body.append("limit ").append(searchLimit).append(";").toString();
    }

    public String byIds(Collection<Long> igdbIds) {
        if (igdbIds == null || igdbIds.isEmpty()) {
            throw new IllegalArgumentException("igdbIds must not be empty");
        }
        String idList = igdbIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        return "fields " + GAME_FIELDS + "; where id = (" + idList + "); limit " + igdbIds.size() + ";";
    }

    /**
     * Well-rated multiplayer games (co-op, split screen, MMO) with enough ratings to be meaningful.
     */
    public String discovery(boolean excludeAdult) {
        StringBuilder where = new StringBuilder("game_modes = (2,3,5) & total_rating_count > 10");
        if (excludeAdult) {
            where.append(" & ").append(adultFilter());
        }
        return "fields " + GAME_FIELDS + "; where " + where + "; sort total_rating desc; limit " + DISCOVERY_LIMIT + ";";
    }

    private String adultFilter() {
        return "themes != (" + Game.ADULT_THEME_ID + ")";
    }
}
