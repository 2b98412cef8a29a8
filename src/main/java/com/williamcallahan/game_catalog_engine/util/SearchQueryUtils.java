package com.williamcallahan.game_catalog_engine.util;

import java.util.Locale;

/**
 * Utility methods for working with search queries.
 * Keeps cache keys, SQL patterns and IGDB query text derived from the same normalization.
 */
public final class SearchQueryUtils {

    public static final String SEARCH_KEY_PREFIX = "igdb:search:";
    public static final String DISCOVER_KEY_PREFIX = "games:discover:";

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Trimmed, lower-cased form used for cache keys. Returns an empty string for null.
     */
    public static String canonicalize(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().toLowerCase(Locale.ROOT);
    }

    public static String searchCacheKey(String query) {
        return SEARCH_KEY_PREFIX + canonicalize(query);
    }

    public static String discoverCacheKey(String rowSlug) {
        return DISCOVER_KEY_PREFIX + rowSlug;
    }

    /**
     * Builds a {@code %term%} pattern for ILIKE with {@code \ % _} escaped,
     * to be used with {@code ESCAPE '\'}.
     */
    public static String likeContainsPattern(String query) {
        String trimmed = query == null ? "" : query.trim();
        StringBuilder sb = new StringBuilder(trimmed.length() + 2);
        sb.append('%');
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\\' || c == '%' || c == '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('%');
        return sb.toString();
    }

    /**
     * Escapes backslashes and double quotes for embedding in an IGDB APIcalypse string literal.
     */
    public static String escapeIgdbString(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
