package com.williamcallahan.game_catalog_engine.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Used when no Redis endpoint is configured. Every lookup misses.
 */
public class NoOpGameSearchCache implements GameSearchCache {

    @Override
    public Optional<CachedGameIds> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, CachedGameIds value, Duration ttl) {
        // Nothing to write to
    }

    @Override
    public long deleteByPrefix(String prefix) {
        return 0;
    }
}
