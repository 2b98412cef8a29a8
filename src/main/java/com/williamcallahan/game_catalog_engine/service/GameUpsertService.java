package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Writes batches of mapped IGDB games into the catalog with a single conflict-resolving statement.
 */
@Service
@Slf4j
public class GameUpsertService {

    private final GameRepository gameRepository;

    public GameUpsertService(GameRepository gameRepository) {
        this.gameRepository = gameRepository;
    }

    /**
     * @return stored rows; empty input issues no statement
     */
    public List<Game> upsertGames(List<Game> games) {
        if (games == null || games.isEmpty()) {
            return List.of();
        }
        List<Game> valid = games.stream()
            .filter(Objects::nonNull)
            .filter(game -> game.getIgdbId() > 0 && game.getName() != null)
            .toList();
        if (valid.isEmpty()) {
            return List.of();
        }
        List<Game> stored = gameRepository.upsertAll(valid);
        log.debug("Upserted {} games ({} submitted)", stored.size(), games.size());
        return stored;
    }
}
