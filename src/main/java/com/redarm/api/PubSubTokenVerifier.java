package com.redarm.api;

import com.google.api.client.googleapis.auth.oauth2.GoogleIdToken;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Collections;

/**
 * Verifies OIDC ID tokens sent by Google Pub/Sub push subscriptions.
 *
 * Verification can be disabled via app.pubsub.push.verification-enabled=false
 * for local runs against the emulator.
 */
@Component
public class PubSubTokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(PubSubTokenVerifier.class);

    private final String expectedAudience;
    private final String expectedEmail;
    private final boolean verificationEnabled;
    private GoogleIdTokenVerifier tokenVerifier;

    public PubSubTokenVerifier(
            @Value("${app.pubsub.push.expected-audience:}") String expectedAudience,
            @Value("${app.pubsub.push.expected-email:}") String expectedEmail,
            @Value("${app.pubsub.push.verification-enabled:true}") boolean verificationEnabled) {
        this.expectedAudience = expectedAudience;
        this.expectedEmail = expectedEmail;
        this.verificationEnabled = verificationEnabled;
    }

    @PostConstruct
    public void initialize() {
        if (!verificationEnabled) {
            logger.warn("Pub/Sub push token verification is DISABLED");
            return;
        }
        if (expectedEmail == null || expectedEmail.isEmpty()) {
            logger.warn("app.pubsub.push.expected-email is not set - all push requests will be rejected");
        }
        GoogleIdTokenVerifier.Builder builder = new GoogleIdTokenVerifier.Builder(new NetHttpTransport(), new GsonFactory());
        if (expectedAudience != null && !expectedAudience.isEmpty()) {
            builder.setAudience(Collections.singletonList(expectedAudience));
        }
        this.tokenVerifier = builder.build();
        logger.info("Pub/Sub token verifier initialized (audience: {}, email: {})", expectedAudience, expectedEmail);
    }

    /**
     * Verifies the push request's Authorization header.
     *
     * Requires a "Bearer" token with a valid Google signature, an email claim
     * equal to the configured push service account, email_verified=true, and
     * the configured audience when one is set.
     *
     * @return true if the token is accepted
     */
    public boolean verifyToken(String authorizationHeader) {
        if (!verificationEnabled) {
            return true;
        }
        if (authorizationHeader == null || !authorizationHeader.startsWith("Bearer ")) {
            logger.warn("Pub/Sub push rejected: missing or malformed Authorization header");
            return false;
        }
        String token = authorizationHeader.substring(7).trim();
        if (token.isEmpty()) {
            logger.warn("Pub/Sub push rejected: empty bearer token");
            return false;
        }
        if (expectedEmail == null || expectedEmail.isEmpty()) {
            logger.warn("Pub/Sub push rejected: expected push email is not configured");
            return false;
        }

        try {
            GoogleIdToken idToken = tokenVerifier.verify(token);
            if (idToken == null) {
                logger.warn("Pub/Sub push rejected: token signature verification failed");
                return false;
            }
            GoogleIdToken.Payload payload = idToken.getPayload();
            if (!expectedEmail.equals(payload.getEmail())) {
                logger.warn("Pub/Sub push rejected: token email {} does not match expected email", payload.getEmail());
                return false;
            }
            if (!Boolean.TRUE.equals(payload.getEmailVerified())) {
                logger.warn("Pub/Sub push rejected: email_verified claim is missing or false");
                return false;
            }
            return true;
        } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
            logger.warn("Pub/Sub push rejected: token verification error: {}", e.getMessage());
            return false;
        }
    }
}
