package com.williamcallahan.game_catalog_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.game_catalog_engine.model.GameVideo;
import com.williamcallahan.game_catalog_engine.model.PlayerCount;
import java.time.Instant;
import java.util.List;

/**
 * Read model returned by search, lookup and discovery endpoints.
 * Moderation flags are not exposed; invisible games never reach this type.
 *
 * @param id local id
 * @param igdbId IGDB id
 * @param firstReleaseDate null when IGDB has no date
 * @param playerCount null when IGDB reports no multiplayer modes
 * @param crossplay null when unknown
 */
public record GameDetail(
    long id,
    @JsonProperty("igdb_id")
    long igdbId,
    String name,
    String slug,
    @JsonProperty("cover_url")
    String coverUrl,
    List<Integer> genres,
    List<Integer> themes,
    List<Integer> platforms,
    @JsonProperty("game_modes")
    List<Integer> gameModes,
    String summary,
    Double rating,
    @JsonProperty("aggregated_rating")
    Double aggregatedRating,
    Double popularity,
    @JsonProperty("first_release_date")
    Instant firstReleaseDate,
    @JsonProperty("player_count")
    PlayerCount playerCount,
    @JsonProperty("twitch_game_id")
    String twitchGameId,
    Boolean crossplay,
    List<String> screenshots,
    List<GameVideo> videos
) {
    public GameDetail {
        genres = genres == null ? List.of() : List.copyOf(genres);
        themes = themes == null ? List.of() : List.copyOf(themes);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        gameModes = gameModes == null ? List.of() : List.copyOf(gameModes);
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        videos = videos == null ? List.of() : List.copyOf(videos);
    }
}
