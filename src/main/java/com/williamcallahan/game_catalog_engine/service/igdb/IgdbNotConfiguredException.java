package com.williamcallahan.game_catalog_engine.service.igdb;

/**
 * Thrown when neither the settings store nor static configuration holds a complete
 * IGDB client id and secret. Search treats it as a soft failure and serves local results.
 */
public class IgdbNotConfiguredException extends RuntimeException {

    public IgdbNotConfiguredException() {
        super("IGDB credentials are not configured");
    }
}
