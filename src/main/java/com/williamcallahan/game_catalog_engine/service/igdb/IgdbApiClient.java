package com.williamcallahan.game_catalog_engine.service.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.util.ExternalApiLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends APIcalypse queries to IGDB. One HTTP call per invocation; retrying is the caller's job.
 */
@Component
@Slf4j
public class IgdbApiClient {

    private static final String API_NAME = "IGDB";

    private final RestTemplate restTemplate;
    private final IgdbConfigurationProperties properties;
    private final IgdbTokenManager tokenManager;
    private final IgdbApiHealthTracker healthTracker;
    private final MetricsService metricsService;

    public IgdbApiClient(RestTemplate restTemplate,
                         IgdbConfigurationProperties properties,
                         IgdbTokenManager tokenManager,
                         IgdbApiHealthTracker healthTracker,
                         MetricsService metricsService) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.tokenManager = tokenManager;
        this.healthTracker = healthTracker;
        this.metricsService = metricsService;
    }

    /**
     * Posts {@code body} to {@code <base-url>/<endpoint>}.
     *
     * @return the JSON array elements; empty when IGDB returns nothing
     * @throws IgdbNotConfiguredException when no credentials exist
     * @throws IgdbRateLimitedException on HTTP 429
     * @throws IgdbUpstreamException on any other failure, including token acquisition
     */
    public List<JsonNode> query(String endpoint, String body) {
        AccessToken token;
        try {
            token = tokenManager.getAccessToken();
        } catch (IgdbNotConfiguredException e) {
            throw e;
        } catch (TokenAcquisitionFailedException e) {
            healthTracker.recordFailure(e.getStatusCode());
            throw new IgdbUpstreamException("Could not obtain IGDB access token", e.getStatusCode(), e);
        }

        HttpHeaders headers = new HttpHeaders();
        // Client-ID must be the one the token was granted to, even if credentials changed since
        headers.set("Client-ID", token.clientId());
        headers.setBearerAuth(token.token());
        headers.setContentType(MediaType.TEXT_PLAIN);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        String url = properties.getBaseUrl() + "/" + endpoint;
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, endpoint, body);
        Timer.Sample sample = metricsService.startUpstreamTimer();
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(url, HttpMethod.POST,
                new HttpEntity<>(body, headers), JsonNode.class);
            healthTracker.recordSuccess(response.getStatusCode().value());
            List<JsonNode> results = toList(response.getBody());
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, endpoint, body, results.size());
            return results;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            healthTracker.recordFailure(status);
            ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint, body, "HTTP " + status);
            if (status == 429) {
                metricsService.incrementApiRateLimit();
                throw new IgdbRateLimitedException();
            }
            throw new IgdbUpstreamException("IGDB request failed with HTTP " + status, status, e);
        } catch (RestClientException e) {
            healthTracker.recordFailure(0);
            ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint, body, e.getMessage());
            throw new IgdbUpstreamException("IGDB request failed: " + e.getMessage(), 0, e);
        } finally {
            metricsService.stopUpstreamTimer(sample);
        }
    }

    private List<JsonNode> toList(JsonNode body) {
        if (body == null || !body.isArray()) {
            return List.of();
        }
        List<JsonNode> nodes = new ArrayList<>(body.size());
        body.forEach(nodes::add);
        return nodes;
    }
}
