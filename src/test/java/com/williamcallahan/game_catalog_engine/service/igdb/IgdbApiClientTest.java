package com.williamcallahan.game_catalog_engine.service.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IgdbApiClientTest {

    private static final String GAMES_URL = "https://api.igdb.com/v4/games";

    @Mock
    private IgdbTokenManager tokenManager;

    private SimpleMeterRegistry meterRegistry;
    private IgdbApiHealthTracker healthTracker;
    private MockRestServiceServer server;
    private IgdbApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        meterRegistry = new SimpleMeterRegistry();
        healthTracker = new IgdbApiHealthTracker();
        client = new IgdbApiClient(restTemplate, new IgdbConfigurationProperties(), tokenManager, healthTracker, new MetricsService(meterRegistry));
    }

    private void configured() {
        when(tokenManager.getAccessToken())
            .thenReturn(new AccessToken("client-1", "token-1", Instant.now().plusSeconds(600)));
    }

    @Test
    void query_sendsAuthHeadersAndReturnsArrayElements() {
        configured();
        server.expect(requestTo(GAMES_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Client-ID", "client-1"))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
            .andExpect(content().string("search \"halo\"; fields name; limit 20;"))
            .andRespond(withSuccess("[{\"id\":1,\"name\":\"Halo\"},{\"id\":2,\"name\":\"Halo 2\"}]",
                MediaType.APPLICATION_JSON));

        List<JsonNode> result = client.query("games", "search \"halo\"; fields name; limit 20;");

        assertThat(result).extracting(node -> node.get("name").asText()).containsExactly("Halo", "Halo 2");
        assertThat(healthTracker.getLastCall().outcome()).isEqualTo(IgdbApiHealthTracker.Outcome.SUCCESS);
        server.verify();
    }

    @Test
    void query_mapsTooManyRequestsToRateLimited() {
        configured();
        server.expect(requestTo(GAMES_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.query("games", "fields name;"))
            .isInstanceOf(IgdbRateLimitedException.class);

        assertThat(healthTracker.getLastCall().outcome()).isEqualTo(IgdbApiHealthTracker.Outcome.RATE_LIMITED);
        assertThat(meterRegistry.counter("igdb.rate_limits").count()).isEqualTo(1.0);
    }

    @Test
    void query_mapsServerErrorToUpstreamFailure() {
        configured();
        server.expect(requestTo(GAMES_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client.query("games", "fields name;"))
            .isInstanceOf(IgdbUpstreamException.class)
            .isNotInstanceOf(IgdbRateLimitedException.class)
            .satisfies(e -> assertThat(((IgdbUpstreamException) e).getStatusCode()).isEqualTo(502));
        assertThat(healthTracker.getLastCall().outcome()).isEqualTo(IgdbApiHealthTracker.Outcome.ERROR);
    }

    @Test
    void query_tokenFailureBecomesUpstreamFailureWithoutHttpCall() {
        when(tokenManager.getAccessToken()).thenThrow(new TokenAcquisitionFailedException(401));
        server.expect(never(), requestTo(GAMES_URL));

        assertThatThrownBy(() -> client.query("games", "fields name;"))
            .isInstanceOf(IgdbUpstreamException.class)
            .hasCauseInstanceOf(TokenAcquisitionFailedException.class);
        server.verify();
    }

    @Test
    void query_notConfiguredPropagates() {
        when(tokenManager.getAccessToken()).thenThrow(new IgdbNotConfiguredException());

        assertThatThrownBy(() -> client.query("games", "fields name;"))
            .isInstanceOf(IgdbNotConfiguredException.class);
    }

    @Test
    void query_sendsClientIdTheTokenWasGrantedTo() {
        when(tokenManager.getAccessToken())
            .thenReturn(new AccessToken("old-client", "old-token", Instant.now().plusSeconds(600)));
        server.expect(requestTo(GAMES_URL))
            .andExpect(header("Client-ID", "old-client"))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer old-token"))
            .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.query("games", "fields name;")).isEmpty();
        server.verify();
    }
}
