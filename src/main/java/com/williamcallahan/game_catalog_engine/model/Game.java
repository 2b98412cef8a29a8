/**
 * Local catalog record for a game mirrored from IGDB
 *
 * Features:
 * - igdbId is the immutable conflict key; a game is never stored twice
 * - hidden and banned are moderation flags owned by this service, never overwritten by a sync
 * - Integer sets (genres, themes, platforms, game modes) hold raw IGDB ids
 */
package com.williamcallahan.game_catalog_engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Game {

    /** IGDB theme id for erotic content. */
    public static final int ADULT_THEME_ID = 42;


    private Long id;
    @EqualsAndHashCode.Include
    @ToString.Include
    private long igdbId;
    @ToString.Include
    private String name;
    private String slug;
    private String coverUrl;
    private List<Integer> genres = new ArrayList<>();
    private List<Integer> themes = new ArrayList<>();
    private List<Integer> platforms = new ArrayList<>();
    private List<Integer> gameModes = new ArrayList<>();
    private String summary;
    private Double rating;
    private Double aggregatedRating;
    private Double popularity;
    private Instant firstReleaseDate;
    private PlayerCount playerCount;
    private String twitchGameId;
    private Boolean crossplay;
    private List<String> screenshots = new ArrayList<>();
    private List<GameVideo> videos = new ArrayList<>();
    private boolean hidden;
    private boolean banned;
    private Instant cachedAt;

    public boolean isVisible() {
        return !hidden && !banned;
    }
}
