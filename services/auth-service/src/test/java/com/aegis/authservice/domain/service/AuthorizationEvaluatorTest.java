package com.aegis.authservice.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aegis.authservice.domain.error.ForbiddenException;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import com.aegis.security.TenantMismatchException;
import com.aegis.security.testing.TestTokenClaimsFactory;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuthorizationEvaluator")
class AuthorizationEvaluatorTest {

    private static final UUID USER = UUID.fromString(TestTokenClaimsFactory.DEFAULT_USER_ID);
    private static final UUID TENANT = UUID.fromString(TestTokenClaimsFactory.DEFAULT_TENANT_ID);

    private IdentityStore identities;
    private AuthorizationEvaluator evaluator;

    @BeforeEach
    void setUp() {
        identities = mock(IdentityStore.class);
        when(identities.findBinding(any(), any())).thenReturn(Optional.empty());
        evaluator = new AuthorizationEvaluator(identities);
    }

    private void holds(Role role) {
        when(identities.findBinding(TENANT, USER)).thenReturn(Optional.of(role));
    }

    @Nested
    @DisplayName("can")
    class Can {

        @Test
        @DisplayName("denies when there is no binding")
        void noBinding() {
            assertThat(evaluator.can(USER, TENANT, Role.MEMBER)).isFalse();
        }

        @Test
        @DisplayName("owner satisfies an admin requirement")
        void ownerIsAdmin() {
            holds(Role.OWNER);

            assertThat(evaluator.can(USER, TENANT, Role.ADMIN)).isTrue();
        }

        @Test
        @DisplayName("member does not satisfy an admin requirement")
        void memberIsNotAdmin() {
            holds(Role.MEMBER);

            assertThat(evaluator.can(USER, TENANT, Role.ADMIN)).isFalse();
            assertThat(evaluator.can(USER, TENANT, Role.MEMBER)).isTrue();
        }

        @Test
        @DisplayName("a null tenant is always denied without a lookup")
        void nullTenant() {
            assertThat(evaluator.can(USER, null, Role.MEMBER)).isFalse();
            verify(identities, never()).findBinding(any(), any());
        }
    }

    @Nested
    @DisplayName("require")
    class Require {

        @Test
        @DisplayName("returns the held role when it is sufficient")
        void sufficient() {
            holds(Role.ADMIN);

            assertThat(evaluator.require(TestTokenClaimsFactory.access(), Role.MEMBER))
                    .isEqualTo(Role.ADMIN);
        }

        @Test
        @DisplayName("uses the stored binding, not the role inside the token")
        void storedRoleWins() {
            holds(Role.MEMBER);
            var claims =
                    TestTokenClaimsFactory.access(USER.toString(), TENANT.toString(), Role.OWNER);

            assertThatThrownBy(() -> evaluator.require(claims, Role.ADMIN))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("tenant-agnostic tokens are denied")
        void agnosticToken() {
            var claims = TestTokenClaimsFactory.tenantAgnosticAccess(USER.toString());

            assertThatThrownBy(() -> evaluator.require(claims, Role.MEMBER))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("a path tenant other than the token's tenant is refused")
        void pathTenantMismatch() {
            holds(Role.OWNER);
            UUID otherTenant = UUID.randomUUID();

            assertThatThrownBy(
                            () ->
                                    evaluator.requireInTenant(
                                            TestTokenClaimsFactory.access(), otherTenant, Role.MEMBER))
                    .isInstanceOf(TenantMismatchException.class);
            verify(identities, never()).findBinding(otherTenant, USER);
        }

        @Test
        @DisplayName("the token's own tenant passes the isolation check")
        void pathTenantMatches() {
            holds(Role.OWNER);

            assertThat(
                            evaluator.requireInTenant(
                                    TestTokenClaimsFactory.access(), TENANT, Role.OWNER))
                    .isEqualTo(Role.OWNER);
        }
    }
}
