package com.williamcallahan.game_catalog_engine.service.igdb;

/**
 * Failure talking to IGDB. statusCode is the HTTP status, or 0 for transport
 * and token failures.
 */
public class IgdbUpstreamException extends RuntimeException {

    private final int statusCode;

    public IgdbUpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public IgdbUpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
