package com.aegis.authservice.domain.service;

import static com.aegis.authservice.support.AuthFixture.PASSWORD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.aegis.authservice.domain.error.AuthServiceException;
import com.aegis.authservice.domain.error.ErrorCode;
import com.aegis.authservice.domain.error.ForbiddenException;
import com.aegis.authservice.domain.error.InactiveUserException;
import com.aegis.authservice.domain.error.InvalidCredentialsException;
import com.aegis.authservice.domain.error.MissingCredentialsException;
import com.aegis.authservice.domain.error.RevokedTokenException;
import com.aegis.authservice.domain.model.Registration;
import com.aegis.authservice.domain.model.TokenPair;
import com.aegis.authservice.support.AuthFixture;
import com.aegis.observability.CorrelationContext;
import com.aegis.observability.CorrelationContextHolder;
import com.aegis.security.ExpiredTokenException;
import com.aegis.security.Role;
import com.aegis.security.WrongTokenTypeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionAuthority")
class SessionAuthorityTest {

    private AuthFixture fx;
    private SessionAuthority sessions;

    @BeforeEach
    void setUp() {
        fx = new AuthFixture();
        sessions = fx.sessions;
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private Registration registerWithTenant(String email) {
        return fx.registrations.register(email, PASSWORD, null, "Acme");
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("user with a single tenant is logged into it with their role")
        void singleTenantIsSelected() {
            Registration reg = registerWithTenant("alice@example.com");

            TokenPair pair = sessions.login("alice@example.com", PASSWORD, null);

            assertThat(pair.accessClaims().subject()).isEqualTo(reg.userId().toString());
            assertThat(pair.accessClaims().tenantId()).isEqualTo(reg.tenantId().toString());
            assertThat(pair.accessClaims().role()).isEqualTo(Role.OWNER);
            assertThat(pair.refreshClaims().jti()).isNotEqualTo(pair.accessClaims().jti());
            assertThat(pair.accessExpiresInSeconds()).isEqualTo(AuthFixture.ACCESS_TTL.toSeconds());
        }

        @Test
        @DisplayName("email lookup ignores case")
        void emailIsCaseInsensitive() {
            registerWithTenant("alice@example.com");

            TokenPair pair = sessions.login("  ALICE@Example.com ", PASSWORD, null);

            assertThat(pair.accessToken()).isNotBlank();
        }

        @Test
        @DisplayName("user without bindings gets tenant-agnostic tokens")
        void noBindingsGivesAgnosticTokens() {
            fx.registrations.register("bob@example.com", PASSWORD, null, null);

            TokenPair pair = sessions.login("bob@example.com", PASSWORD, null);

            assertThat(pair.accessClaims().isTenantScoped()).isFalse();
            assertThat(pair.accessClaims().role()).isNull();
        }

        @Test
        @DisplayName("user with several tenants must name one to get a scoped token")
        void severalTenants() {
            Registration reg = registerWithTenant("carol@example.com");
            var second = fx.provisioner.provision("Second", reg.userId());

            assertThat(sessions.login("carol@example.com", PASSWORD, null).accessClaims().tenantId())
                    .isNull();
            assertThat(
                            sessions.login("carol@example.com", PASSWORD, second.id())
                                    .accessClaims()
                                    .tenantId())
                    .isEqualTo(second.id().toString());
        }

        @Test
        @DisplayName("naming a tenant the user does not belong to is forbidden")
        void foreignTenantIsForbidden() {
            registerWithTenant("dave@example.com");
            Registration other = registerWithTenant("erin@example.com");

            assertThatThrownBy(() -> sessions.login("dave@example.com", PASSWORD, other.tenantId()))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("wrong password and unknown email fail identically")
        void failuresAreIndistinguishable() {
            registerWithTenant("frank@example.com");

            var wrongPassword =
                    catchThrowableOfType(
                            () -> sessions.login("frank@example.com", "not-it", null),
                            AuthServiceException.class);
            var unknownEmail =
                    catchThrowableOfType(
                            () -> sessions.login("nobody@example.com", PASSWORD, null),
                            AuthServiceException.class);

            assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class);
            assertThat(unknownEmail).isInstanceOf(InvalidCredentialsException.class);
            assertThat(wrongPassword.code()).isEqualTo(unknownEmail.code());
            assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
            assertThat(fx.counter(SessionAuthority.METRIC_LOGIN, "invalid_credentials"))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("inactive user is reported only after the password matched")
        void inactiveUser() {
            Registration reg = registerWithTenant("grace@example.com");
            fx.identities.setUserActive(reg.userId(), false);

            assertThatThrownBy(() -> sessions.login("grace@example.com", PASSWORD, null))
                    .isInstanceOf(InactiveUserException.class);
            assertThatThrownBy(() -> sessions.login("grace@example.com", "wrong", null))
                    .isInstanceOf(InvalidCredentialsException.class);
        }

        @Test
        @DisplayName("successful logins are counted")
        void successIsCounted() {
            registerWithTenant("heidi@example.com");

            sessions.login("heidi@example.com", PASSWORD, null);

            assertThat(fx.counter(SessionAuthority.METRIC_LOGIN, "success")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        @DisplayName("rotates to a new pair with the same subject, tenant and role")
        void rotates() {
            registerWithTenant("ivan@example.com");
            TokenPair first = sessions.login("ivan@example.com", PASSWORD, null);

            TokenPair second = sessions.refresh(first.refreshToken());

            assertThat(second.refreshClaims().jti()).isNotEqualTo(first.refreshClaims().jti());
            assertThat(second.accessClaims().subject()).isEqualTo(first.accessClaims().subject());
            assertThat(second.accessClaims().tenantId()).isEqualTo(first.accessClaims().tenantId());
            assertThat(second.accessClaims().role()).isEqualTo(first.accessClaims().role());
        }

        @Test
        @DisplayName("a refresh token can be used only once")
        void singleUse() {
            registerWithTenant("judy@example.com");
            TokenPair first = sessions.login("judy@example.com", PASSWORD, null);
            TokenPair second = sessions.refresh(first.refreshToken());

            assertThatThrownBy(() -> sessions.refresh(first.refreshToken()))
                    .isInstanceOf(RevokedTokenException.class)
                    .extracting(e -> ((AuthServiceException) e).code())
                    .isEqualTo(ErrorCode.REVOKED_TOKEN);
            assertThat(sessions.refresh(second.refreshToken())).isNotNull();
        }

        @Test
        @DisplayName("of concurrent refreshes with the same token exactly one succeeds")
        void concurrentRefreshHasOneWinner() throws Exception {
            registerWithTenant("ken@example.com");
            String refreshToken = sessions.login("ken@example.com", PASSWORD, null).refreshToken();
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<TokenPair>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<TokenPair> call =
                            () -> {
                                start.await();
                                return sessions.refresh(refreshToken);
                            };
                    results.add(pool.submit(call));
                }
                start.countDown();

                int successes = 0;
                int revoked = 0;
                for (Future<TokenPair> result : results) {
                    try {
                        result.get(10, TimeUnit.SECONDS);
                        successes++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(RevokedTokenException.class);
                        revoked++;
                    }
                }
                assertThat(successes).isEqualTo(1);
                assertThat(revoked).isEqualTo(threads - 1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("an access token is not accepted as a refresh token")
        void accessTokenRejected() {
            registerWithTenant("leo@example.com");
            TokenPair pair = sessions.login("leo@example.com", PASSWORD, null);

            assertThatThrownBy(() -> sessions.refresh(pair.accessToken()))
                    .isInstanceOf(WrongTokenTypeException.class);
        }

        @Test
        @DisplayName("an expired refresh token is rejected")
        void expired() {
            registerWithTenant("mia@example.com");
            TokenPair pair = sessions.login("mia@example.com", PASSWORD, null);
            fx.clock.advance(AuthFixture.REFRESH_TTL);

            assertThatThrownBy(() -> sessions.refresh(pair.refreshToken()))
                    .isInstanceOf(ExpiredTokenException.class);
        }

        @Test
        @DisplayName("a deactivated user cannot refresh")
        void deactivatedUser() {
            Registration reg = registerWithTenant("nina@example.com");
            TokenPair pair = sessions.login("nina@example.com", PASSWORD, null);
            fx.identities.setUserActive(reg.userId(), false);

            assertThatThrownBy(() -> sessions.refresh(pair.refreshToken()))
                    .isInstanceOf(InactiveUserException.class);
        }
    }

    @Nested
    @DisplayName("access validation")
    class AccessValidation {

        @Test
        @DisplayName("validates a fresh access token without touching the stores")
        void validates() {
            registerWithTenant("olga@example.com");
            TokenPair pair = sessions.login("olga@example.com", PASSWORD, null);

            assertThat(sessions.validateAccess(pair.accessToken())).isEqualTo(pair.accessClaims());
        }

        @Test
        @DisplayName("access token expires after its TTL")
        void expires() {
            registerWithTenant("pat@example.com");
            TokenPair pair = sessions.login("pat@example.com", PASSWORD, null);
            fx.clock.advance(AuthFixture.ACCESS_TTL);

            assertThatThrownBy(() -> sessions.validateAccess(pair.accessToken()))
                    .isInstanceOf(ExpiredTokenException.class);
        }

        @Test
        @DisplayName("a refresh token is not an access token")
        void refreshTokenRejected() {
            registerWithTenant("quinn@example.com");
            TokenPair pair = sessions.login("quinn@example.com", PASSWORD, null);

            assertThatThrownBy(() -> sessions.validateAccess(pair.refreshToken()))
                    .isInstanceOf(WrongTokenTypeException.class);
        }

        @Test
        @DisplayName("authenticate requires a bearer header")
        void authenticateRequiresBearer() {
            assertThatThrownBy(() -> sessions.authenticate(null))
                    .isInstanceOf(MissingCredentialsException.class);
            assertThatThrownBy(() -> sessions.authenticate("Basic dXNlcjpwYXNz"))
                    .isInstanceOf(MissingCredentialsException.class);
        }

        @Test
        @DisplayName("authenticate binds the principal to the logging context")
        void authenticateBindsPrincipal() {
            Registration reg = registerWithTenant("rita@example.com");
            TokenPair pair = sessions.login("rita@example.com", PASSWORD, null);
            CorrelationContextHolder.set(CorrelationContext.anonymous("cid-1", "rid-1"));

            sessions.authenticate("Bearer " + pair.accessToken());

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.userId()).isEqualTo(reg.userId().toString());
            assertThat(ctx.tenantId()).isEqualTo(reg.tenantId().toString());
            assertThat(ctx.correlationId()).isEqualTo("cid-1");
        }
    }

    @Nested
    @DisplayName("revocation")
    class Revocation {

        @Test
        @DisplayName("revoking twice is a no-op")
        void idempotent() {
            var expiresAt = AuthFixture.START.plus(Duration.ofDays(1));

            sessions.revoke("jti-1", expiresAt);

            assertThatCode(() -> sessions.revoke("jti-1", expiresAt)).doesNotThrowAnyException();
            assertThat(fx.revocations.isRevoked("jti-1")).isTrue();
        }

        @Test
        @DisplayName("logout revokes the refresh token")
        void logoutRevokes() {
            registerWithTenant("sam@example.com");
            TokenPair pair = sessions.login("sam@example.com", PASSWORD, null);

            sessions.logout(pair.refreshToken());

            assertThatThrownBy(() -> sessions.refresh(pair.refreshToken()))
                    .isInstanceOf(RevokedTokenException.class);
        }

        @Test
        @DisplayName("logout with an expired refresh token succeeds quietly")
        void logoutExpired() {
            registerWithTenant("tina@example.com");
            TokenPair pair = sessions.login("tina@example.com", PASSWORD, null);
            fx.clock.advance(AuthFixture.REFRESH_TTL.plusSeconds(1));

            assertThatCode(() -> sessions.logout(pair.refreshToken())).doesNotThrowAnyException();
            assertThat(fx.revocations.isRevoked(pair.refreshClaims().jti())).isFalse();
        }

        @Test
        @DisplayName("purge drops records whose tokens have expired")
        void purge() {
            sessions.revoke("short", AuthFixture.START.plus(Duration.ofMinutes(5)));
            sessions.revoke("long", AuthFixture.START.plus(Duration.ofDays(5)));
            fx.clock.advance(Duration.ofHours(1));

            assertThat(sessions.purgeExpiredRevocations()).isEqualTo(1);
            assertThat(fx.revocations.isRevoked("short")).isFalse();
            assertThat(fx.revocations.isRevoked("long")).isTrue();
        }
    }
}
