package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.dto.SyncStatus;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import org.springframework.stereotype.Service;

@Service
public class CatalogStatusService {

    private final GameRepository gameRepository;
    private final GameCatalogSynchronizer synchronizer;

    public CatalogStatusService(GameRepository gameRepository, GameCatalogSynchronizer synchronizer) {
        this.gameRepository = gameRepository;
        this.synchronizer = synchronizer;
    }

    public SyncStatus getSyncStatus() {
        return new SyncStatus(
            synchronizer.getLastSyncAt(),
            gameRepository.count(),
            synchronizer.isSyncInProgress(),
            synchronizer.getLastResult()
        );
    }
}
