package com.aegis.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Configuration properties")
class PropertiesTest {

    @Nested
    @DisplayName("ServiceProperties")
    class Service {

        @Test
        @DisplayName("accepts valid properties")
        void acceptsValidProperties() {
            var props = new ServiceProperties("auth-service", "production", "Auth");

            assertThat(props.name()).isEqualTo("auth-service");
            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.description()).isEqualTo("Auth");
        }

        @Test
        @DisplayName("defaults environment to 'development' when blank")
        void defaultsEnvironment() {
            assertThat(new ServiceProperties("s", null, null).environment()).isEqualTo("development");
            assertThat(new ServiceProperties("s", " ", null).environment()).isEqualTo("development");
        }
    }

    @Nested
    @DisplayName("AuthProperties")
    class Auth {

        @Test
        @DisplayName("applies defaults for everything but the secret")
        void defaults() {
            var props = new AuthProperties(null, null, "secret", null, null, null, null);

            assertThat(props.issuer()).isEqualTo(AuthProperties.DEFAULT_ISSUER);
            assertThat(props.signingAlgorithm()).isEqualTo("HS256");
            assertThat(props.accessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
            assertThat(props.refreshTokenTtl()).isEqualTo(Duration.ofDays(7));
            assertThat(props.bcryptStrength()).isEqualTo(10);
            assertThat(props.revocationPurgeInterval()).isEqualTo(Duration.ofHours(1));
            assertThat(props.signingSecret()).isEqualTo("secret");
        }

        @Test
        @DisplayName("keeps explicit values")
        void explicitValues() {
            var props =
                    new AuthProperties(
                            "issuer-x",
                            "HS512",
                            "secret",
                            Duration.ofMinutes(5),
                            Duration.ofDays(1),
                            12,
                            Duration.ofMinutes(10));

            assertThat(props.issuer()).isEqualTo("issuer-x");
            assertThat(props.signingAlgorithm()).isEqualTo("HS512");
            assertThat(props.accessTokenTtl()).isEqualTo(Duration.ofMinutes(5));
            assertThat(props.bcryptStrength()).isEqualTo(12);
        }
    }

    @Nested
    @DisplayName("StoreProperties")
    class Store {

        @Test
        @DisplayName("defaults to jdbc with a five second timeout")
        void defaults() {
            var props = new StoreProperties(null, null);

            assertThat(props.mode()).isEqualTo("jdbc");
            assertThat(props.queryTimeout()).isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("replaces a non-positive timeout")
        void nonPositiveTimeout() {
            assertThat(new StoreProperties("memory", Duration.ZERO).queryTimeout())
                    .isEqualTo(Duration.ofSeconds(5));
        }
    }
}
