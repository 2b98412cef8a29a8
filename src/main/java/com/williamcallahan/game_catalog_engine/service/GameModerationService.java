package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.dto.ModerationResult;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.repository.GameRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Curatorial (hide) and policy (ban) flags on catalog games.
 * Cached search and browse results are re-read through the visibility filter,
 * so nothing in the fast cache needs to be touched here.
 */
@Service
@Slf4j
public class GameModerationService {

    private final GameRepository gameRepository;

    public GameModerationService(GameRepository gameRepository) {
        this.gameRepository = gameRepository;
    }

    public ModerationResult hideGame(long id) {
        return apply(id, true, gameRepository::updateHidden, "hidden from users");
    }

    public ModerationResult unhideGame(long id) {
        return apply(id, false, gameRepository::updateHidden, "visible to users again");
    }

    public ModerationResult banGame(long id) {
        return apply(id, true, gameRepository::updateBanned, "banned");
    }

    public ModerationResult unbanGame(long id) {
        return apply(id, false, gameRepository::updateBanned, "unbanned");
    }

    /**
     * Hides every visible game carrying the adult theme.
     *
     * @return number of games hidden
     */
    public int hideAdultGames() {
        int hidden = gameRepository.hideAdultThemed();
        log.info("Hid {} adult-themed games", hidden);
        return hidden;
    }

    private ModerationResult apply(long id, boolean flag, BiFunction<Long, Boolean, Integer> update, String outcome) {
        Optional<Game> game = gameRepository.findById(id);
        if (game.isEmpty()) {
            return ModerationResult.notFound();
        }
        String name = game.get().getName();
        // The row can be deleted between the lookup and the update
        if (update.apply(id, flag) == 0) {
            log.info("Game {} disappeared before it could be {}", id, outcome);
            return ModerationResult.notFound();
        }
        log.info("Game {} ({}) {}", id, name, outcome);
        return ModerationResult.ok("\"" + name + "\" is now " + outcome + ".", name);
    }
}
