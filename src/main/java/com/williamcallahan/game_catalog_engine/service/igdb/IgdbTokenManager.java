package com.williamcallahan.game_catalog_engine.service.igdb;

import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.monitoring.MetricsService;
import com.williamcallahan.game_catalog_engine.service.SettingsChangeListener;
import com.williamcallahan.game_catalog_engine.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the IGDB access token.
 * <p>
 * A valid cached token is returned directly. Otherwise at most one fetch is in flight: the
 * caller that claims the slot runs it on its own thread, and every caller arriving meanwhile
 * waits on the same future for at most the configured wait timeout. The slot is cleared once
 * the fetch settles so a failure is not remembered. Changing the IGDB credentials drops the
 * token, and a fetch started under the old credentials does not store its result.
 */
@Service
@Slf4j
public class IgdbTokenManager implements SettingsChangeListener {

    public enum TokenState {
        NO_TOKEN,
        FETCHING,
        VALID,
        EXPIRED
    }

    private final IgdbCredentialResolver credentialResolver;
    private final TwitchIdentityClient identityClient;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration waitTimeout;

    private final AtomicReference<AccessToken> currentToken = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<AccessToken>> inFlight = new AtomicReference<>();
    private final AtomicLong credentialGeneration = new AtomicLong();

    @Autowired
    public IgdbTokenManager(IgdbCredentialResolver credentialResolver,
                            TwitchIdentityClient identityClient,
                            SettingsService settingsService,
                            MetricsService metricsService,
                            IgdbConfigurationProperties properties) {
        this(credentialResolver, identityClient, metricsService, Clock.systemUTC(),
            Duration.ofMillis(properties.getTokenWaitTimeoutMs()));
        settingsService.addChangeListener(this);
    }

    IgdbTokenManager(IgdbCredentialResolver credentialResolver,
                     TwitchIdentityClient identityClient,
                     MetricsService metricsService,
                     Clock clock,
                     Duration waitTimeout) {
        this.credentialResolver = credentialResolver;
        this.identityClient = identityClient;
        this.metricsService = metricsService;
        this.clock = clock;
        this.waitTimeout = waitTimeout;
    }

    /**
     * @return a valid token together with the client id it was granted to
     * @throws IgdbNotConfiguredException when no credentials exist
     * @throws TokenAcquisitionFailedException when the identity provider refuses the grant,
     *         or the fetch another caller started does not settle within the wait timeout
     */
    public AccessToken getAccessToken() {
        AccessToken token = currentToken.get();
        if (token != null && token.isValidAt(clock.instant())) {
            return token;
        }
        CompletableFuture<AccessToken> fetch = acquire();
        try {
            return fetch.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TokenAcquisitionFailedException("Token acquisition failed", cause);
        } catch (TimeoutException e) {
            log.warn("Gave up waiting {}ms for the in-flight IGDB token fetch", waitTimeout.toMillis());
            throw new TokenAcquisitionFailedException("Timed out waiting for IGDB access token", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenAcquisitionFailedException("Interrupted while waiting for IGDB access token", e);
        }
    }

    public String getToken() {
        return getAccessToken().token();
    }

    /**
     * Drops the cached token. A fetch already running completes for its waiters but is not cached.
     */
    public void invalidate() {
        credentialGeneration.incrementAndGet();
        currentToken.set(null);
        log.info("IGDB access token invalidated");
    }

    @Override
    public void onSettingChanged(String key) {
        if (SettingsService.IGDB_CLIENT_ID.equals(key) || SettingsService.IGDB_CLIENT_SECRET.equals(key)) {
            invalidate();
        }
    }

    public TokenState getTokenState() {
        if (inFlight.get() != null) {
            return TokenState.FETCHING;
        }
        AccessToken token = currentToken.get();
        if (token == null) {
            return TokenState.NO_TOKEN;
        }
        return token.isValidAt(clock.instant()) ? TokenState.VALID : TokenState.EXPIRED;
    }

    private CompletableFuture<AccessToken> acquire() {
        while (true) {
            CompletableFuture<AccessToken> existing = inFlight.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<AccessToken> fetch = new CompletableFuture<>();
            if (!inFlight.compareAndSet(null, fetch)) {
                continue;
            }
            // Another fetch may have settled between our token check and winning the slot
            AccessToken token = currentToken.get();
            if (token != null && token.isValidAt(clock.instant())) {
                settle(fetch, token, null);
                return fetch;
            }
            runFetch(fetch, credentialGeneration.get());
            return fetch;
        }
    }

    private void runFetch(CompletableFuture<AccessToken> fetch, long generation) {
        try {
            IgdbCredentials credentials = credentialResolver.resolve();
            metricsService.incrementTokenFetch();
            AccessToken token = identityClient.fetchToken(credentials);
            if (credentialGeneration.get() == generation) {
                currentToken.set(token);
            } else {
                log.info("IGDB credentials changed during token fetch; not caching the result");
            }
            log.debug("Obtained IGDB access token valid until {}", token.expiresAt());
            settle(fetch, token, null);
        } catch (IgdbNotConfiguredException e) {
            settle(fetch, null, e);
        } catch (RuntimeException e) {
            metricsService.incrementTokenFetchFailure();
            log.warn("IGDB token fetch failed: {}", e.getMessage());
            settle(fetch, null, e);
        } finally {
            if (!fetch.isDone()) {
                settle(fetch, null, new TokenAcquisitionFailedException("IGDB token fetch ended without a result", null));
            }
        }
    }

    private void settle(CompletableFuture<AccessToken> fetch, AccessToken token, RuntimeException failure) {
        inFlight.compareAndSet(fetch, null);
        if (failure != null) {
            fetch.completeExceptionally(failure);
        } else {
            fetch.complete(token);
        }
    }
}
