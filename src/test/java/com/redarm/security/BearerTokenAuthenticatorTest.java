package com.redarm.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redarm.shared.error.AuthException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BearerTokenAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator(
            TestTokens.SECRET, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void validTokenYieldsNormalizedIdentity() {
        Identity identity = authenticator.authenticate(TestTokens.bearer("  Alice@Example.COM ", NOW));

        assertThat(identity.getEmail()).isEqualTo("alice@example.com");
        assertThat(identity.getRole()).isEqualTo("user");
    }

    @Test
    void audienceMayBeAnArray() {
        ObjectNode claims = TestTokens.claims("alice@example.com", NOW, 60);
        claims.putArray("aud").add("other").add(BearerTokenAuthenticator.AUDIENCE);

        Identity identity = authenticator.authenticate("Bearer " + TestTokens.token(TestTokens.SECRET, claims, "HS256"));

        assertThat(identity.getEmail()).isEqualTo("alice@example.com");
    }

    @Test
    void missingHeaderIsUnauthenticated() {
        assertThatThrownBy(() -> authenticator.authenticate(null))
                .isInstanceOf(AuthException.class)
                .hasMessage("Missing bearer token")
                .extracting(e -> ((AuthException) e).getStatus())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThatThrownBy(() -> authenticator.authenticate("Basic abc"))
                .hasMessage("Missing bearer token");
    }

    @Test
    void expiredTokenIsRejected() {
        String header = TestTokens.bearer("alice@example.com", NOW.minusSeconds(7200));

        assertThatThrownBy(() -> authenticator.authenticate(header))
                .isInstanceOf(AuthException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = TestTokens.token("some-other-secret", TestTokens.claims("alice@example.com", NOW, 60), "HS256");

        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + token))
                .hasMessage("Invalid or expired token");
    }

    @Test
    void wrongIssuerOrAlgorithmIsRejected() {
        ObjectNode claims = TestTokens.claims("alice@example.com", NOW, 60);
        claims.put("iss", "someone-else");
        String wrongIssuer = TestTokens.token(TestTokens.SECRET, claims, "HS256");
        String wrongAlg = TestTokens.token(TestTokens.SECRET, TestTokens.claims("alice@example.com", NOW, 60), "none");

        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + wrongIssuer))
                .hasMessage("Invalid or expired token");
        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + wrongAlg))
                .hasMessage("Invalid or expired token");
    }

    @Test
    void garbageTokenIsRejected() {
        assertThatThrownBy(() -> authenticator.authenticate("Bearer not.a.jwt"))
                .hasMessage("Invalid or expired token");
    }
}
