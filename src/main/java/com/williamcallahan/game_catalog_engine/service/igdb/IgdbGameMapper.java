package com.williamcallahan.game_catalog_engine.service.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.model.GameVideo;
import com.williamcallahan.game_catalog_engine.model.PlayerCount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps IGDB game JSON onto {@link Game}. Missing or malformed fields become null or
 * empty; a record without an id or name is dropped.
 */
@Component
@Slf4j
public class IgdbGameMapper {

    static final int TWITCH_EXTERNAL_CATEGORY = 14;

    private final String imageBaseUrl;

    public IgdbGameMapper(IgdbConfigurationProperties properties) {
        this.imageBaseUrl = properties.getImageBaseUrl();
    }

    public List<Game> toGames(List<JsonNode> nodes) {
        List<Game> games = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            Game game = toGame(node);
            if (game != null) {
                games.add(game);
            }
        }
        return games;
    }

    /**
     * @return null when the node has no id or name
     */
    public Game toGame(JsonNode node) {
        if (node == null || !node.path("id").canConvertToLong() || !node.hasNonNull("name")) {
            log.debug("Skipping IGDB record without id or name: {}", node);
            return null;
        }
        Game game = new Game();
        game.setIgdbId(node.get("id").asLong());
        game.setName(node.get("name").asText());
        game.setSlug(textOrNull(node, "slug"));
        game.setCoverUrl(imageUrl("t_cover_big", node.path("cover").path("image_id")));
        game.setGenres(intList(node.path("genres")));
        game.setThemes(intList(node.path("themes")));
        game.setPlatforms(intList(node.path("platforms")));
        game.setGameModes(intList(node.path("game_modes")));
        game.setSummary(textOrNull(node, "summary"));
        game.setRating(doubleOrNull(node, "rating"));
        game.setAggregatedRating(doubleOrNull(node, "aggregated_rating"));
        game.setPopularity(popularity(node));
        if (node.path("first_release_date").canConvertToLong()) {
            game.setFirstReleaseDate(Instant.ofEpochSecond(node.get("first_release_date").asLong()));
        }
        game.setPlayerCount(playerCount(node.path("multiplayer_modes")));
        game.setCrossplay(crossplay(node.path("multiplayer_modes")));
        game.setTwitchGameId(twitchGameId(node.path("external_games")));
        game.setScreenshots(screenshots(node.path("screenshots")));
        game.setVideos(videos(node.path("videos")));
        return game;
    }

    PlayerCount playerCount(JsonNode modes) {
        if (!modes.isArray() || modes.isEmpty()) {
            return null;
        }
        int max = 0;
        for (JsonNode mode : modes) {
            max = Math.max(max, mode.path("onlinemax").asInt(0));
            max = Math.max(max, mode.path("offlinemax").asInt(0));
        }
        return max > 0 ? new PlayerCount(1, max) : null;
    }

    /**
     * True when online play is reported on two or more distinct platforms.
     */
    Boolean crossplay(JsonNode modes) {
        if (!modes.isArray() || modes.isEmpty()) {
            return null;
        }
        Set<Integer> onlinePlatforms = new HashSet<>();
        for (JsonNode mode : modes) {
            boolean online = mode.path("onlinecoop").asBoolean(false) || mode.path("onlinemax").asInt(0) > 1;
            if (online && mode.path("platform").canConvertToInt()) {
                onlinePlatforms.add(mode.get("platform").asInt());
            }
        }
        return onlinePlatforms.size() >= 2;
    }

    String twitchGameId(JsonNode externalGames) {
        if (!externalGames.isArray()) {
            return null;
        }
        for (JsonNode external : externalGames) {
            if (external.path("category").asInt(-1) == TWITCH_EXTERNAL_CATEGORY && external.hasNonNull("uid")) {
                return external.get("uid").asText();
            }
        }
        return null;
    }

    private Double popularity(JsonNode node) {
        Double ratingCount = doubleOrNull(node, "total_rating_count");
        return ratingCount != null ? ratingCount : doubleOrNull(node, "hypes");
    }

    private List<String> screenshots(JsonNode screenshots) {
        List<String> urls = new ArrayList<>();
        if (screenshots.isArray()) {
            for (JsonNode screenshot : screenshots) {
                String url = imageUrl("t_screenshot_big", screenshot.path("image_id"));
                if (url != null) {
                    urls.add(url);
                }
            }
        }
        return urls;
    }

    private List<GameVideo> videos(JsonNode videos) {
        List<GameVideo> result = new ArrayList<>();
        if (videos.isArray()) {
            for (JsonNode video : videos) {
                if (video.hasNonNull("video_id")) {
                    result.add(new GameVideo(textOrNull(video, "name"), video.get("video_id").asText()));
                }
            }
        }
        return result;
    }

    private String imageUrl(String size, JsonNode imageId) {
        if (imageId == null || !imageId.isTextual() || imageId.asText().isBlank()) {
            return null;
        }
        return imageBaseUrl + "/" + size + "/" + imageId.asText() + ".jpg";
    }

    private static List<Integer> intList(JsonNode array) {
        List<Integer> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode value : array) {
                if (value.canConvertToInt()) {
                    values.add(value.asInt());
                }
            }
        }
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
