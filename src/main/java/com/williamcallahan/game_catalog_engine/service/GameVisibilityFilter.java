package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import org.springframework.stereotype.Component;

/**
 * Decides which games end users may see.
 * <p>
 * Hidden and banned games are never shown. Games carrying the adult theme are
 * additionally excluded while the adult filter setting is on. The SQL form of the
 * rule lives in {@link GameRepository#visibilityPredicate(boolean)}; this class
 * supplies the current flag and the in-memory equivalent.
 */
@Component
public class GameVisibilityFilter {

    private final SettingsService settingsService;

    public GameVisibilityFilter(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    public boolean excludeAdult() {
        return settingsService.isAdultFilterEnabled();
    }

    public boolean isVisible(Game game) {
        return isVisible(game, excludeAdult());
    }

    public boolean isVisible(Game game, boolean excludeAdult) {
        if (game == null || !game.isVisible()) {
            return false;
        }
        return !excludeAdult || game.getThemes() == null || !game.getThemes().contains(Game.ADULT_THEME_ID);
    }
}
