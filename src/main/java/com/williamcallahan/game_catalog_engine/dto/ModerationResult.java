package com.williamcallahan.game_catalog_engine.dto;

/**
 * Outcome of a moderation action on a single game.
 *
 * @param name game name, null when the game does not exist
 */
public record ModerationResult(boolean success, String message, String name) {

    public static ModerationResult notFound() {
        return new ModerationResult(false, "Game not found", null);
    }

    public static ModerationResult ok(String message, String name) {
        return new ModerationResult(true, message, name);
    }
}
