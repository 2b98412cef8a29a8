package com.williamcallahan.game_catalog_engine.service.igdb;

/**
 * IGDB answered 429. The only failure the retry controller retries.
 */
public class IgdbRateLimitedException extends IgdbUpstreamException {

    public IgdbRateLimitedException() {
        super("IGDB rate limit exceeded", 429);
    }
}
