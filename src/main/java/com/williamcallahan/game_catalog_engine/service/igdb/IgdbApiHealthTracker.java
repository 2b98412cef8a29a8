package com.williamcallahan.game_catalog_engine.service.igdb;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the outcome of the most recent IGDB call for the health endpoint.
 */
@Component
public class IgdbApiHealthTracker {

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        ERROR
    }

    public record LastCall(Outcome outcome, int statusCode, Instant at) {
    }

    private final AtomicReference<LastCall> lastCall = new AtomicReference<>();

    public void recordSuccess(int statusCode) {
        lastCall.set(new LastCall(Outcome.SUCCESS, statusCode, Instant.now()));
    }

    public void recordFailure(int statusCode) {
        Outcome outcome = statusCode == 429 ? Outcome.RATE_LIMITED : Outcome.ERROR;
        lastCall.set(new LastCall(outcome, statusCode, Instant.now()));
    }

    /**
     * @return null until the first call completes
     */
    public LastCall getLastCall() {
        return lastCall.get();
    }
}
