package com.redarm.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CloudSecretsValidatorTest {

    private MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.password", "db-pass")
                .withProperty("app.security.jwt-secret", "a-real-secret-for-the-cloud-profile")
                .withProperty("app.security.url-signing-secret", "signing-secret");
    }

    @Test
    void acceptsCompleteSecrets() {
        assertThatCode(() -> new CloudSecretsValidator(validEnvironment()).validateSecrets())
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsDefaultJwtSecret() {
        MockEnvironment env = validEnvironment()
                .withProperty("app.security.jwt-secret", CloudSecretsValidator.DEFAULT_JWT_SECRET);

        assertThatThrownBy(() -> new CloudSecretsValidator(env).validateSecrets())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("APP_SECURITY_JWT_SECRET");
    }

    @Test
    void rejectsMissingDatabasePassword() {
        MockEnvironment env = validEnvironment().withProperty("spring.datasource.password", " ");

        assertThatThrownBy(() -> new CloudSecretsValidator(env).validateSecrets())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DB_PASSWORD");
    }

    @Test
    void rejectsMissingUrlSigningSecret() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("spring.datasource.password", "db-pass")
                .withProperty("app.security.jwt-secret", "a-real-secret-for-the-cloud-profile");

        assertThatThrownBy(() -> new CloudSecretsValidator(env).validateSecrets())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("URL_SIGNING_SECRET");
    }
}
