package com.williamcallahan.game_catalog_engine.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.game_catalog_engine.repository.SettingsRepository;
import com.williamcallahan.game_catalog_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runtime configuration backed by {@code app_settings}.
 * <p>
 * All rows are read in a single query into a short-lived snapshot. Concurrent readers
 * on a cold snapshot share one load. Writes go to the database first and then drop
 * the snapshot, after which registered listeners are told which key changed.
 */
@Service
@Slf4j
public class SettingsService {

    public static final String IGDB_CLIENT_ID = "igdb.client_id";
    public static final String IGDB_CLIENT_SECRET = "igdb.client_secret";
    public static final String IGDB_FILTER_ADULT = "igdb.filter_adult";

    private static final String SNAPSHOT_KEY = "all";

    private final SettingsRepository settingsRepository;
    private final Cache<String, Map<String, String>> snapshot;
    private final List<SettingsChangeListener> listeners = new CopyOnWriteArrayList<>();

    public SettingsService(SettingsRepository settingsRepository,
                           @Value("${app.settings.cache-ttl-seconds:60}") long cacheTtlSeconds) {
        this.settingsRepository = settingsRepository;
        this.snapshot = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(cacheTtlSeconds))
            .maximumSize(1)
            .build();
    }

    public void addChangeListener(SettingsChangeListener listener) {
        listeners.add(listener);
    }

    public String get(String key) {
        return currentSnapshot().get(key);
    }

    public boolean exists(String key) {
        return currentSnapshot().containsKey(key);
    }

    public void set(String key, String value) {
        settingsRepository.upsert(key, value);
        invalidateCache();
        notifyListeners(key);
    }

    public void delete(String key) {
        settingsRepository.delete(key);
        invalidateCache();
        notifyListeners(key);
    }

    /**
     * Drops the snapshot so the next read reloads from the database. Writes call this after
     * the database write, so a load that raced the write is not kept.
     */
    public void invalidateCache() {
        // Removing by key waits for a load in progress, so its result is discarded too
        snapshot.invalidate(SNAPSHOT_KEY);
    }

    public Optional<Map.Entry<String, String>> getIgdbConfig() {
        String clientId = get(IGDB_CLIENT_ID);
        String clientSecret = get(IGDB_CLIENT_SECRET);
        if (!ValidationUtils.hasText(clientId) || !ValidationUtils.hasText(clientSecret)) {
            return Optional.empty();
        }
        return Optional.of(Map.entry(clientId, clientSecret));
    }

    public void setIgdbConfig(String clientId, String clientSecret) {
        set(IGDB_CLIENT_ID, clientId);
        set(IGDB_CLIENT_SECRET, clientSecret);
    }

    public void clearIgdbConfig() {
        delete(IGDB_CLIENT_ID);
        delete(IGDB_CLIENT_SECRET);
    }

    public boolean isIgdbConfigured() {
        return getIgdbConfig().isPresent();
    }

    /**
     * True only when the stored value is exactly {@code "true"}.
     */
    public boolean isAdultFilterEnabled() {
        return "true".equals(get(IGDB_FILTER_ADULT));
    }

    public void setAdultFilterEnabled(boolean enabled) {
        set(IGDB_FILTER_ADULT, Boolean.toString(enabled));
    }

    private Map<String, String> currentSnapshot() {
        return snapshot.get(SNAPSHOT_KEY, ignored -> {
            Map<String, String> loaded = settingsRepository.findAll();
            log.debug("Loaded {} settings from database", loaded.size());
            return Map.copyOf(loaded);
        });
    }

    private void notifyListeners(String key) {
        for (SettingsChangeListener listener : listeners) {
            try {
                listener.onSettingChanged(key);
            } catch (RuntimeException e) {
                log.error("Settings listener failed for key {}: {}", key, e.getMessage(), e);
            }
        }
    }
}
