package com.williamcallahan.game_catalog_engine.util;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {

    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Returns the trimmed value, or null when it has no text.
     */
    public static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
