package com.redarm.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers shared by handlers and workers.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns the value, or "unknown" when it is null or blank.
     * Used for log fields and metric tags.
     */
    @Nonnull
    public static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value;
    }

    /**
     * Returns the value, or the given default when it is null or blank.
     */
    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    /**
     * Trims the value, mapping null to the empty string.
     */
    @Nonnull
    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Returns null for null or blank input, otherwise the value unchanged.
     */
    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
