package com.williamcallahan.game_catalog_engine.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Best-effort fast cache in front of the durable store.
 * Implementations never throw: failures are logged and reported as misses or no-ops.
 */
public interface GameSearchCache {

    Optional<CachedGameIds> get(String key);

    void put(String key, CachedGameIds value, Duration ttl);

    /**
     * Deletes every key starting with {@code prefix}.
     *
     * @return number of keys removed
     */
    long deleteByPrefix(String prefix);
}
