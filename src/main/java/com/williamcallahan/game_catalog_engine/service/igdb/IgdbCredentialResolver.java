package com.williamcallahan.game_catalog_engine.service.igdb;

import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.service.SettingsService;
import com.williamcallahan.game_catalog_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the IGDB client id and secret.
 * The settings store wins over static configuration, and both values must come from the same source.
 */
@Component
@Slf4j
public class IgdbCredentialResolver {

    private final SettingsService settingsService;
    private final IgdbConfigurationProperties properties;

    public IgdbCredentialResolver(SettingsService settingsService, IgdbConfigurationProperties properties) {
        this.settingsService = settingsService;
        this.properties = properties;
    }

    /**
     * @throws IgdbNotConfiguredException when no source holds both values
     */
    public IgdbCredentials resolve() {
        Optional<Map.Entry<String, String>> stored = settingsService.getIgdbConfig();
        if (stored.isPresent()) {
            return new IgdbCredentials(stored.get().getKey().trim(), stored.get().getValue().trim(),
                IgdbCredentials.Source.SETTINGS);
        }
        String clientId = ValidationUtils.trimToNull(properties.getClientId());
        String clientSecret = ValidationUtils.trimToNull(properties.getClientSecret());
        if (clientId != null && clientSecret != null) {
            return new IgdbCredentials(clientId, clientSecret, IgdbCredentials.Source.STATIC_CONFIG);
        }
        throw new IgdbNotConfiguredException();
    }

    public boolean isConfigured() {
        try {
            resolve();
            return true;
        } catch (IgdbNotConfiguredException e) {
            return false;
        } catch (RuntimeException e) {
            log.warn("Could not read IGDB credentials: {}", e.getMessage());
            return false;
        }
    }
}
