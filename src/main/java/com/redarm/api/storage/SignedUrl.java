package com.redarm.api.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Time-limited, permission-scoped URL for a single blob.
 */
public final class SignedUrl {

    private final String url;
    private final Instant expiresOn;

    public SignedUrl(String url, Instant expiresOn) {
        this.url = Objects.requireNonNull(url, "url");
        this.expiresOn = Objects.requireNonNull(expiresOn, "expiresOn");
    }

    public String getUrl() {
        return url;
    }

    public Instant getExpiresOn() {
        return expiresOn;
    }

    @Override
    public String toString() {
        return "SignedUrl{expiresOn=" + expiresOn + "}";
    }
}
