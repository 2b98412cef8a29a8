package com.williamcallahan.game_catalog_engine.dto;

import java.util.List;

/**
 * A browse row such as "popular" or "top-rated".
 */
public record DiscoveryRow(String slug, String title, List<GameDetail> games) {

    public DiscoveryRow {
        games = games == null ? List.of() : List.copyOf(games);
    }
}
