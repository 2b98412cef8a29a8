package com.williamcallahan.game_catalog_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to Twitch and IGDB and for the layered search flow.
 * <p>
 * Lines carry the {@code [EXTERNAL-API]} prefix so one grep follows a search through:
 * - Redis fast cache
 * - Postgres durable store
 * - IGDB upstream
 * - degraded local search
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    public static void logRateLimited(Logger log, String apiName, int attempt, int maxAttempts, long delayMs) {
        log.warn("{} [{}] RATE-LIMITED: attempt {}/{}, backing off {}ms", PREFIX, apiName, attempt, maxAttempts, delayMs);
    }

    public static void logTieredSearchLayer(Logger log, String query, String layer, int resultCount) {
        log.info("{} [TIERED-SEARCH] {}: query='{}', results={}", PREFIX, layer, query, resultCount);
    }

    public static void logFallback(Logger log, String query, String reason) {
        log.warn("{} [TIERED-SEARCH] DEGRADED: upstream unavailable for query='{}' - {}, serving local results", PREFIX, query, reason);
    }
}
