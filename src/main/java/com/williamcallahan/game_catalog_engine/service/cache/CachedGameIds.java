package com.williamcallahan.game_catalog_engine.service.cache;

import java.util.List;

/**
 * Fast-cache payload: local game ids in result order and the layer that first produced them.
 */
public record CachedGameIds(List<Long> ids, String source) {

    public CachedGameIds {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }
}
