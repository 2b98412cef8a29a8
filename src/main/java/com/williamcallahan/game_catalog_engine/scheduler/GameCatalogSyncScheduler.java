/**
 * Scheduler that keeps the local game catalog in step with IGDB
 * - Runs a full catalog sync on a cron schedule (every six hours by default)
 * - Can be switched off with app.igdb.sync.enabled=false
 *
 * @author William Callahan
 */
package com.williamcallahan.game_catalog_engine.scheduler;

import com.williamcallahan.game_catalog_engine.dto.SyncResult;
import com.williamcallahan.game_catalog_engine.service.GameCatalogSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class GameCatalogSyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(GameCatalogSyncScheduler.class);

    private final GameCatalogSynchronizer synchronizer;

    @Value("${app.igdb.sync.enabled:true}")
    private boolean syncEnabled;

    public GameCatalogSyncScheduler(GameCatalogSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Scheduled(cron = "${app.igdb.sync.cron:0 0 */6 * * *}")
    public void syncCatalog() {
        if (!syncEnabled) {
            logger.debug("Scheduled catalog sync is disabled");
            return;
        }
        try {
            SyncResult result = synchronizer.syncAll();
            if (result.skipped()) {
                logger.info("Scheduled catalog sync skipped; a sync is already running");
            }
        } catch (RuntimeException e) {
            logger.error("Scheduled catalog sync failed: {}", e.getMessage(), e);
        }
    }
}
