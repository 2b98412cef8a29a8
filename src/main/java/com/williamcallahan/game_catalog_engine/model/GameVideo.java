package com.williamcallahan.game_catalog_engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trailer or gameplay video reference. videoId is a YouTube id.
 */
public record GameVideo(String name, @JsonProperty("video_id") String videoId) {
}
