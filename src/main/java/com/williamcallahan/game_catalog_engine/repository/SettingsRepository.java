package com.williamcallahan.game_catalog_engine.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;

/**
 * Key/value access to the {@code app_settings} table.
 */
@Repository
public class SettingsRepository {

    private final JdbcTemplate jdbcTemplate;

    public SettingsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Loads every setting in one query.
     */
    public Map<String, String> findAll() {
        Map<String, String> settings = new HashMap<>();
        jdbcTemplate.query("SELECT key, value FROM app_settings",
            rs -> {
                settings.put(rs.getString("key"), rs.getString("value"));
            });
        return settings;
    }

    public void upsert(String key, String value) {
        jdbcTemplate.update("""
            INSERT INTO app_settings (key, value, updated_at)
            VALUES (?, ?, now())
            ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = now()
            """, key, value);
    }

    public int delete(String key) {
        return jdbcTemplate.update("DELETE FROM app_settings WHERE key = ?", key);
    }
}
