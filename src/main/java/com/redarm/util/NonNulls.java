package com.redarm.util;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Non-null guards usable as proof boundaries for null analysis.
 */
public final class NonNulls {

    private NonNulls() {
        // Utility class
    }

    /**
     * Ensures that a value is non-null.
     *
     * @throws NullPointerException if value is null
     */
    @Nonnull
    public static <T> T nn(T value, String message) {
        return Objects.requireNonNull(value, message);
    }

    /**
     * Ensures that a string is non-null and non-blank.
     *
     * @throws IllegalStateException if value is null or blank
     */
    @Nonnull
    public static String requireNonBlank(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(message);
        }
        return value;
    }
}
