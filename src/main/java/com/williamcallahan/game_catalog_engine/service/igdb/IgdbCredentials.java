package com.williamcallahan.game_catalog_engine.service.igdb;

/**
 * A complete client id / secret pair and where it came from.
 */
public record IgdbCredentials(String clientId, String clientSecret, Source source) {

    public enum Source {
        SETTINGS,
        STATIC_CONFIG
    }

    @Override
    public String toString() {
        return "IgdbCredentials[clientId=" + clientId + ", source=" + source + "]";
    }
}
