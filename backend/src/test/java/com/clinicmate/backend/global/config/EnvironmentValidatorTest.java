package com.clinicmate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/clinicmate")
                .withProperty("jwt.secret", "clinicmate-test-access-secret-0123456789abcdef")
                .withProperty("jwt.expiration", "900000")
                .withProperty("jwt.refresh-expiration", "604800000");
    }

    @Test
    void acceptsACompleteConfiguration() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.validate()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void rejectsThePlaceholderSecret() {
        environment.setProperty("jwt.secret", "change-me-in-production");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("jwt.secret: replace the placeholder with a random value");
    }

    @Test
    void rejectsShortSecrets() {
        environment.setProperty("jwt.refresh-secret", "too-short");

        assertThat(new EnvironmentValidator(environment).validate())
                .singleElement()
                .asString()
                .startsWith("jwt.refresh-secret: must be at least 32 bytes");
    }

    @Test
    void reportsMissingKeys() {
        MockEnvironment empty = new MockEnvironment();

        assertThat(new EnvironmentValidator(empty).validate()).contains(
                "spring.datasource.url: required",
                "jwt.secret: required",
                "jwt.expiration: required",
                "jwt.refresh-expiration: required");
    }

    @Test
    void refreshLifetimeMustExceedAccessLifetime() {
        environment.setProperty("jwt.refresh-expiration", "600000");
        environment.setProperty("jwt.expiration", "900000");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("jwt.refresh-expiration: must be longer than jwt.expiration");
    }

    @Test
    void accessLifetimeOutsideBoundsFailsStartup() {
        environment.setProperty("jwt.expiration", "60000");

        assertThatThrownBy(new EnvironmentValidator(environment)::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration");
    }

    @Test
    void nonNumericLifetimeIsReported() {
        environment.setProperty("jwt.expiration", "15m");

        assertThat(new EnvironmentValidator(environment).validate())
                .contains("jwt.expiration: must be a number");
    }
}
