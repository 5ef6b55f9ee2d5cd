package com.redarm.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to start a cloud deployment with development secrets.
 */
@Component
@Profile("cloud")
public class CloudSecretsValidator {

    private static final Logger logger = LoggerFactory.getLogger(CloudSecretsValidator.class);
    static final String DEFAULT_JWT_SECRET = "change-me-in-production";

    private final Environment environment;

    public CloudSecretsValidator(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void validateSecrets() {
        String jwtSecret = environment.getProperty("app.security.jwt-secret");
        String signingSecret = environment.getProperty("app.security.url-signing-secret");
        String dbPassword = environment.getProperty("spring.datasource.password");

        if (dbPassword == null || dbPassword.trim().isEmpty()) {
            throw new IllegalStateException("DB_PASSWORD is required in cloud profile (spring.datasource.password is empty)");
        }

        if (jwtSecret == null || jwtSecret.trim().isEmpty() || DEFAULT_JWT_SECRET.equals(jwtSecret)) {
            throw new IllegalStateException("APP_SECURITY_JWT_SECRET must be set to a non-default value in cloud profile");
        }

        if (signingSecret == null || signingSecret.trim().isEmpty()) {
            throw new IllegalStateException("APP_SECURITY_URL_SIGNING_SECRET is required in cloud profile");
        }

        logger.info("Cloud secrets validation passed.");
    }
}
