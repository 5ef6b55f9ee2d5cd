package com.redarm.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redarm.shared.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;

/**
 * Resolves the caller identity from an {@code Authorization: Bearer <jwt>} header.
 * Tokens are HS256 JWTs issued by the login service with the shared secret;
 * subject is the user's email, {@code role} an optional claim.
 */
@Service
public class BearerTokenAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticator.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    static final String ISSUER = "redarm-cheap-backend";
    static final String AUDIENCE = "redarm-cheap-ui";

    private final byte[] secret;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public BearerTokenAuthenticator(@Value("${app.security.jwt-secret:change-me-in-production}") String jwtSecret,
                                    ObjectMapper objectMapper) {
        this(jwtSecret, objectMapper, Clock.systemUTC());
    }

    BearerTokenAuthenticator(String jwtSecret, ObjectMapper objectMapper, Clock clock) {
        if (jwtSecret == null || jwtSecret.isEmpty()) {
            throw new IllegalStateException("app.security.jwt-secret must be set");
        }
        if ("change-me-in-production".equals(jwtSecret)) {
            logger.warn("Using default JWT secret! Set APP_SECURITY_JWT_SECRET in production.");
        }
        this.secret = jwtSecret.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Verifies the bearer token and returns the identity it carries.
     *
     * @param authorizationHeader raw Authorization header value (may be null)
     * @return the authenticated identity
     * @throws AuthException (401) if the token is missing or invalid
     */
    public Identity authenticate(String authorizationHeader) {
        String token = extractBearerToken(authorizationHeader);
        if (token == null) {
            throw AuthException.unauthenticated("Missing bearer token");
        }

        try {
            JsonNode claims = verify(token);
            String email = claims.path("sub").asText("");
            if (email.isBlank()) {
                throw new IllegalArgumentException("token has no subject");
            }
            return new Identity(email, claims.path("role").asText("user"));
        } catch (Exception e) {
            logger.debug("Bearer token rejected: {}", e.getMessage());
            throw AuthException.unauthenticated("Invalid or expired token");
        }
    }

    private String extractBearerToken(String header) {
        if (header == null) {
            return null;
        }
        String[] parts = header.trim().split("\\s+");
        if (parts.length != 2 || !"bearer".equalsIgnoreCase(parts[0]) || parts[1].isEmpty()) {
            return null;
        }
        return parts[1];
    }

    private JsonNode verify(String token) throws Exception {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("malformed token");
        }

        Base64.Decoder decoder = Base64.getUrlDecoder();
        JsonNode header = objectMapper.readTree(decoder.decode(parts[0]));
        if (!"HS256".equals(header.path("alg").asText())) {
            throw new IllegalArgumentException("unsupported alg");
        }

        byte[] expected = sign(parts[0] + "." + parts[1]);
        byte[] actual = decoder.decode(parts[2]);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new IllegalArgumentException("bad signature");
        }

        JsonNode claims = objectMapper.readTree(decoder.decode(parts[1]));
        long now = clock.instant().getEpochSecond();

        if (!claims.hasNonNull("exp") || claims.get("exp").asLong() <= now) {
            throw new IllegalArgumentException("token expired");
        }
        if (claims.hasNonNull("nbf") && claims.get("nbf").asLong() > now) {
            throw new IllegalArgumentException("token not yet valid");
        }
        if (!ISSUER.equals(claims.path("iss").asText())) {
            throw new IllegalArgumentException("unexpected issuer");
        }
        if (!hasAudience(claims.get("aud"))) {
            throw new IllegalArgumentException("unexpected audience");
        }
        return claims;
    }

    private boolean hasAudience(JsonNode aud) {
        if (aud == null) {
            return false;
        }
        if (aud.isArray()) {
            for (JsonNode value : aud) {
                if (AUDIENCE.equals(value.asText())) {
                    return true;
                }
            }
            return false;
        }
        return AUDIENCE.equals(aud.asText());
    }

    private byte[] sign(String signingInput) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
        return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
    }
}
