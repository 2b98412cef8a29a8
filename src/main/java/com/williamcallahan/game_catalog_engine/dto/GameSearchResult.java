package com.williamcallahan.game_catalog_engine.dto;

import java.util.List;

/**
 * Outcome of a layered search.
 *
 * @param games visible games in result order
 * @param cached true when served without contacting IGDB
 * @param source layer that produced the result
 */
public record GameSearchResult(List<GameDetail> games, boolean cached, SearchSource source) {

    public GameSearchResult {
        games = games == null ? List.of() : List.copyOf(games);
    }

    public boolean isEmpty() {
        return games.isEmpty();
    }
}
