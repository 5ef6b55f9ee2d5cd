package com.redarm.util;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Canonical form for owner emails: trimmed and lowercased.
 * Ownership checks compare canonical forms only.
 */
public final class Emails {

    private Emails() {
        // Utility class
    }

    @Nonnull
    public static String normalize(String email) {
        return Strings.trimToEmpty(email).toLowerCase(Locale.ROOT);
    }

    public static boolean sameOwner(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }
}
