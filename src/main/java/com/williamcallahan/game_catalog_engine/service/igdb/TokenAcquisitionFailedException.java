package com.williamcallahan.game_catalog_engine.service.igdb;

/**
 * The identity provider refused or failed the client-credentials grant.
 */
public class TokenAcquisitionFailedException extends RuntimeException {

    private final int statusCode;

    public TokenAcquisitionFailedException(int statusCode) {
        super("Failed to obtain IGDB access token: HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public TokenAcquisitionFailedException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
