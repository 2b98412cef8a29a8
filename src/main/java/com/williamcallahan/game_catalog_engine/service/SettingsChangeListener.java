package com.williamcallahan.game_catalog_engine.service;

/**
 * Callback invoked after a setting is written or deleted.
 */
@FunctionalInterface
public interface SettingsChangeListener {

    void onSettingChanged(String key);
}
