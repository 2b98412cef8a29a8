/**
 * Health indicator for the IGDB integration
 *
 * @author William Callahan
 *
 * Reports whether credentials exist, the token state and the outcome of the last IGDB call.
 * Missing credentials are UP with configured=false: search still works from the local catalog.
 */
package com.williamcallahan.game_catalog_engine.config;

import com.williamcallahan.game_catalog_engine.service.igdb.IgdbApiHealthTracker;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbCredentialResolver;
import com.williamcallahan.game_catalog_engine.service.igdb.IgdbTokenManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("igdbHealthIndicator")
public class IgdbHealthIndicator implements HealthIndicator {

    private final IgdbCredentialResolver credentialResolver;
    private final IgdbTokenManager tokenManager;
    private final IgdbApiHealthTracker healthTracker;

    public IgdbHealthIndicator(IgdbCredentialResolver credentialResolver,
                               IgdbTokenManager tokenManager,
                               IgdbApiHealthTracker healthTracker) {
        this.credentialResolver = credentialResolver;
        this.tokenManager = tokenManager;
        this.healthTracker = healthTracker;
    }

    @Override
    public Health health() {
        boolean configured = credentialResolver.isConfigured();
        IgdbApiHealthTracker.LastCall lastCall = healthTracker.getLastCall();

        Health.Builder builder;
        if (!configured || lastCall == null || lastCall.outcome() == IgdbApiHealthTracker.Outcome.SUCCESS) {
            builder = Health.up();
        } else if (lastCall.outcome() == IgdbApiHealthTracker.Outcome.RATE_LIMITED) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.down();
        }

        builder.withDetail("configured", configured)
            .withDetail("token_state", tokenManager.getTokenState().name());
        if (lastCall != null) {
            builder.withDetail("last_call_outcome", lastCall.outcome().name())
                .withDetail("last_call_status", lastCall.statusCode())
                .withDetail("last_call_at", lastCall.at().toString());
        }
        return builder.build();
    }
}
