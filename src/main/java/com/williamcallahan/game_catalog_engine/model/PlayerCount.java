package com.williamcallahan.game_catalog_engine.model;

/**
 * Supported player range derived from IGDB multiplayer modes.
 *
 * @param min always at least 1
 * @param max largest online or offline maximum reported
 */
public record PlayerCount(int min, int max) {
}
