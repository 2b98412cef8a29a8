package com.williamcallahan.game_catalog_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static IGDB configuration bound from {@code igdb.*}.
 * Credentials here are the fallback used when the settings store holds none.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "igdb")
public class IgdbConfigurationProperties {

    private String clientId;

    private String clientSecret;

    private String baseUrl = "https://api.igdb.com/v4";

    private String tokenUrl = "https://id.twitch.tv/oauth2/token";

    private String imageBaseUrl = "https://images.igdb.com/igdb/image/upload";

    /** Seconds subtracted from expires_in so a token is renewed before Twitch rejects it. */
    private long tokenExpiryBufferSeconds = 300;

    /** How long a caller waits on a token fetch started by another thread. */
    private long tokenWaitTimeoutMs = 30000;

    private int searchLimit = 20;
}
