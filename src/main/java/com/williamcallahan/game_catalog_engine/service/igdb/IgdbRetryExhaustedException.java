package com.williamcallahan.game_catalog_engine.service.igdb;

public class IgdbRetryExhaustedException extends IgdbUpstreamException {

    public IgdbRetryExhaustedException(int attempts, Throwable lastFailure) {
        super("IGDB still rate limited after " + attempts + " attempts", 429, lastFailure);
    }
}
