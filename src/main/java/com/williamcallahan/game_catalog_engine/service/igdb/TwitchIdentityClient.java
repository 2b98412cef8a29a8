package com.williamcallahan.game_catalog_engine.service.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Performs the OAuth2 client-credentials grant against the Twitch identity endpoint.
 * One call per invocation, no retries.
 */
@Component
@Slf4j
public class TwitchIdentityClient {

    private static final String API_NAME = "TWITCH";

    private final RestTemplate restTemplate;
    private final IgdbConfigurationProperties properties;
    private final Clock clock;

    public TwitchIdentityClient(RestTemplate restTemplate, IgdbConfigurationProperties properties) {
        this(restTemplate, properties, Clock.systemUTC());
    }

    TwitchIdentityClient(RestTemplate restTemplate, IgdbConfigurationProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return token whose expiry is {@code now + expires_in - buffer}
     * @throws TokenAcquisitionFailedException on a non-2xx answer, a transport error or a malformed body
     */
    public AccessToken fetchToken(IgdbCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", credentials.clientId());
        form.add("client_secret", credentials.clientSecret());
        form.add("grant_type", "client_credentials");

        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "token", credentials.clientId());
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(properties.getTokenUrl(), new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientResponseException e) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "token", credentials.clientId(),
                "HTTP " + e.getStatusCode().value());
            throw new TokenAcquisitionFailedException(e.getStatusCode().value());
        } catch (RestClientException e) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "token", credentials.clientId(), e.getMessage());
            throw new TokenAcquisitionFailedException("Token request failed: " + e.getMessage(), e);
        }

        JsonNode body = response.getBody();
        if (body == null || !body.hasNonNull("access_token") || !body.hasNonNull("expires_in")) {
            throw new TokenAcquisitionFailedException("Token response missing access_token or expires_in", null);
        }
        long expiresIn = body.get("expires_in").asLong();
        Instant expiresAt = clock.instant()
            .plusSeconds(expiresIn)
            .minusSeconds(properties.getTokenExpiryBufferSeconds());
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "token", credentials.clientId(), 1);
        return new AccessToken(credentials.clientId(), body.get("access_token").asText(), expiresAt);
    }
}
