package com.redarm.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * HMAC-SHA256 signatures for locally served blob URLs.
 * Signatures are base64url without padding.
 */
@Service
public class UrlSigner {

    private static final Logger logger = LoggerFactory.getLogger(UrlSigner.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    public UrlSigner(@Value("${app.security.url-signing-secret:}") String signingSecret) {
        if (signingSecret == null || signingSecret.isBlank()) {
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            this.secret = random;
            logger.warn("No URL signing secret configured; using a random per-process secret. "
                    + "Signed URLs will not survive a restart.");
        } else {
            this.secret = signingSecret.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Computes the signature of the given canonical string.
     */
    public String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute URL signature", e);
        }
    }

    /**
     * Constant-time check of a presented signature.
     */
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sign(payload).getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }
}
