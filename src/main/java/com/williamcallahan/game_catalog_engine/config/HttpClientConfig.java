/**
 * Configuration for the blocking HTTP client used against Twitch and IGDB
 *
 * @author William Callahan
 */
package com.williamcallahan.game_catalog_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    /**
     * RestTemplate with connect/read timeouts from app.http.*
     */
    @Bean
    public RestTemplate restTemplate(@Value("${app.http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${app.http.read-timeout-ms:10000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
