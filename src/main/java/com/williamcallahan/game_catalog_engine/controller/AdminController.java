/**
 * REST Controller for administrative catalog operations
 *
 * @author William Callahan
 *
 * Features:
 * - Triggers a catalog sync and reports its status
 * - Hides, unhides, bans and unbans individual games
 * - Manages IGDB credentials and the adult content filter
 */

package com.williamcallahan.game_catalog_engine.controller;

import com.williamcallahan.game_catalog_engine.dto.ModerationResult;
import com.williamcallahan.game_catalog_engine.dto.SyncResult;
import com.williamcallahan.game_catalog_engine.dto.SyncStatus;
import com.williamcallahan.game_catalog_engine.service.CatalogStatusService;
import com.williamcallahan.game_catalog_engine.service.GameCatalogSynchronizer;
import com.williamcallahan.game_catalog_engine.service.GameModerationService;
import com.williamcallahan.game_catalog_engine.service.SettingsService;
import com.williamcallahan.game_catalog_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    public record IgdbCredentialsRequest(String clientId, String clientSecret) {
    }

    public record AdultFilterRequest(Boolean enabled) {
    }

    private final GameCatalogSynchronizer synchronizer;
    private final CatalogStatusService catalogStatusService;
    private final GameModerationService moderationService;
    private final SettingsService settingsService;

    public AdminController(GameCatalogSynchronizer synchronizer,
                           CatalogStatusService catalogStatusService,
                           GameModerationService moderationService,
                           SettingsService settingsService) {
        this.synchronizer = synchronizer;
        this.catalogStatusService = catalogStatusService;
        this.moderationService = moderationService;
        this.settingsService = settingsService;
    }

    /**
     * Runs a catalog sync on the task executor and answers when it completes.
     * 409 when another sync is already running.
     */
    @PostMapping("/games/sync")
    public CompletableFuture<ResponseEntity<SyncResult>> triggerSync() {
        logger.info("Admin endpoint /admin/games/sync invoked");
        return synchronizer.syncAllAsync()
            .thenApply(result -> result.skipped()
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                : ResponseEntity.ok(result));
    }

    @GetMapping("/games/sync/status")
    public SyncStatus syncStatus() {
        return catalogStatusService.getSyncStatus();
    }

    @PostMapping("/games/{id}/hide")
    public ResponseEntity<ModerationResult> hide(@PathVariable("id") long id) {
        return toResponse(moderationService.hideGame(id));
    }

    @PostMapping("/games/{id}/unhide")
    public ResponseEntity<ModerationResult> unhide(@PathVariable("id") long id) {
        return toResponse(moderationService.unhideGame(id));
    }

    @PostMapping("/games/{id}/ban")
    public ResponseEntity<ModerationResult> ban(@PathVariable("id") long id) {
        return toResponse(moderationService.banGame(id));
    }

    @PostMapping("/games/{id}/unban")
    public ResponseEntity<ModerationResult> unban(@PathVariable("id") long id) {
        return toResponse(moderationService.unbanGame(id));
    }

    @PostMapping("/games/hide-adult")
    public Map<String, Object> hideAdultGames() {
        int hidden = moderationService.hideAdultGames();
        return Map.of("success", true, "hiddenCount", hidden);
    }

    /**
     * Stores IGDB credentials and starts a sync in the background.
     */
    @PutMapping("/settings/igdb")
    public Map<String, Object> updateIgdbCredentials(@RequestBody IgdbCredentialsRequest request) {
        if (request == null || !ValidationUtils.hasText(request.clientId()) || !ValidationUtils.hasText(request.clientSecret())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "clientId and clientSecret are required");
        }
        settingsService.setIgdbConfig(request.clientId().trim(), request.clientSecret().trim());
        logger.info("IGDB credentials updated; starting catalog sync");
        synchronizer.syncAllAsync().exceptionally(e -> {
            logger.error("Catalog sync after credential update failed: {}", e.getMessage(), e);
            return null;
        });
        return Map.of("success", true, "message", "IGDB configuration saved");
    }

    @DeleteMapping("/settings/igdb")
    public Map<String, Object> clearIgdbCredentials() {
        settingsService.clearIgdbConfig();
        return Map.of("success", true, "message", "IGDB configuration cleared");
    }

    /**
     * Turns the adult content filter on or off. Turning it on also hides stored adult-themed games.
     */
    @PutMapping("/settings/adult-filter")
    public Map<String, Object> updateAdultFilter(@RequestBody AdultFilterRequest request) {
        if (request == null || request.enabled() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "enabled is required");
        }
        boolean enabled = request.enabled();
        settingsService.setAdultFilterEnabled(enabled);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("enabled", enabled);
        if (enabled) {
            int hidden = moderationService.hideAdultGames();
            body.put("hiddenCount", hidden);
            body.put("message", hidden > 0
                ? "Adult content filter enabled. " + hidden + " games with adult themes were hidden."
                : "Adult content filter enabled.");
        } else {
            body.put("message", "Adult content filter disabled.");
        }
        return body;
    }

    private ResponseEntity<ModerationResult> toResponse(ModerationResult result) {
        return result.success()
            ? ResponseEntity.ok(result)
            : ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }
}
