package com.williamcallahan.game_catalog_engine.dto;

/**
 * Summary of one catalog sync run.
 *
 * @param refreshedCount existing games re-fetched and upserted
 * @param discoveredCount games upserted from the discovery query
 * @param failedBatches refresh batches that failed and were skipped
 * @param skipped true when another sync was already running and this call did nothing
 */
public record SyncResult(int refreshedCount, int discoveredCount, int failedBatches, boolean skipped) {

    public static SyncResult skippedRun() {
        return new SyncResult(0, 0, 0, true);
    }

    public static SyncResult empty() {
        return new SyncResult(0, 0, 0, false);
    }
}
