package com.williamcallahan.game_catalog_engine.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Layer that produced a search result.
 */
public enum SearchSource {
    FAST_CACHE("fast-cache"),
    DURABLE_STORE("durable-store"),
    UPSTREAM("upstream"),
    DEGRADED_LOCAL("degraded-local");

    private final String tag;

    SearchSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
