package com.williamcallahan.game_catalog_engine.service.igdb;

import java.time.Instant;

/**
 * Bearer token with its effective expiry (already shortened by the safety buffer)
 * and the client id it was granted to. IGDB requests send both together.
 */
public record AccessToken(String clientId, String token, Instant expiresAt) {

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken[clientId=" + clientId + ", expiresAt=" + expiresAt + "]";
    }
}
