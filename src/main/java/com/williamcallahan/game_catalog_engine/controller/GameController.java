/**
 * Read-only game endpoints: layered and catalog-only search, lookup by id and browse rows
 *
 * @author William Callahan
 */
package com.williamcallahan.game_catalog_engine.controller;

import com.williamcallahan.game_catalog_engine.dto.DiscoveryRow;
import com.williamcallahan.game_catalog_engine.dto.GameDetail;
import com.williamcallahan.game_catalog_engine.dto.GameSearchResult;
import com.williamcallahan.game_catalog_engine.service.GameDiscoveryService;
import com.williamcallahan.game_catalog_engine.service.GameSearchService;
import com.williamcallahan.game_catalog_engine.util.ValidationUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/games")
public class GameController {

    static final int MAX_QUERY_LENGTH = 100;

    private final GameSearchService gameSearchService;
    private final GameDiscoveryService gameDiscoveryService;

    public GameController(GameSearchService gameSearchService, GameDiscoveryService gameDiscoveryService) {
        this.gameSearchService = gameSearchService;
        this.gameDiscoveryService = gameDiscoveryService;
    }

    @GetMapping("/search")
    public GameSearchResult search(@RequestParam(name = "q", required = false) String query) {
        validateQuery(query);
        return gameSearchService.searchGames(query);
    }

    /**
     * Catalog-only search that never contacts IGDB.
     */
    @GetMapping("/search/local")
    public List<GameDetail> searchLocal(@RequestParam(name = "q", required = false) String query) {
        validateQuery(query);
        return gameSearchService.searchLocalGames(query);
    }

    @GetMapping("/discover")
    public List<DiscoveryRow> discover() {
        return gameDiscoveryService.getDiscoveryRows();
    }

    @GetMapping("/{id}")
    public GameDetail getGame(@PathVariable("id") long id) {
        return gameSearchService.getGameById(id)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Game not found"));
    }

    private static void validateQuery(String query) {
        if (!ValidationUtils.hasText(query)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Query parameter 'q' is required");
        }
        if (query.trim().length() > MAX_QUERY_LENGTH) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Query must be at most " + MAX_QUERY_LENGTH + " characters");
        }
    }
}
