package com.williamcallahan.game_catalog_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * @param lastSyncAt completion time of the last sync, null if none ran since startup
 * @param lastResult result of that sync, null if none ran
 */
public record SyncStatus(
    @JsonProperty("last_sync_at")
    Instant lastSyncAt,
    @JsonProperty("game_count")
    long gameCount,
    @JsonProperty("sync_in_progress")
    boolean syncInProgress,
    @JsonProperty("last_result")
    SyncResult lastResult
) {
}
