package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.error.ForbiddenException;
import com.aegis.authservice.domain.error.InactiveUserException;
import com.aegis.authservice.domain.error.InvalidCredentialsException;
import com.aegis.authservice.domain.error.MissingCredentialsException;
import com.aegis.authservice.domain.error.RevokedTokenException;
import com.aegis.authservice.domain.model.RevocationRecord;
import com.aegis.authservice.domain.model.RoleBinding;
import com.aegis.authservice.domain.model.TokenPair;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.authservice.domain.port.RevocationStore;
import com.aegis.observability.CorrelationContextHolder;
import com.aegis.observability.MetricFactory;
import com.aegis.observability.SensitiveDataRedactor;
import com.aegis.security.BearerTokenExtractor;
import com.aegis.security.CredentialHasher;
import com.aegis.security.ExpiredTokenException;
import com.aegis.security.Role;
import com.aegis.security.TokenClaims;
import com.aegis.security.TokenCodec;
import com.aegis.security.TokenException;
import com.aegis.security.TokenType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates, rotates and revokes tokens.
 *
 * <p>Session lifecycle: {@code Anonymous -> Authenticated -> Refreshed* -> Revoked | Expired}.
 *
 * <ul>
 *   <li>Access tokens are validated statelessly and simply expire.
 *   <li>Refresh tokens are single use: each {@link #refresh} atomically revokes the presented
 *       token's {@code jti} before issuing a new pair, so of two concurrent refreshes with the
 *       same token exactly one wins.
 * </ul>
 *
 * <p>Login failures never reveal whether the email exists: an unknown email still costs one
 * hash verification and yields the same {@link InvalidCredentialsException}.
 */
public class SessionAuthority {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthority.class);

    static final String METRIC_LOGIN = "aegis.auth.login";
    static final String METRIC_REFRESH = "aegis.auth.refresh";

    private final IdentityStore identities;
    private final RevocationStore revocations;
    private final CredentialHasher hasher;
    private final TokenCodec codec;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Clock clock;
    private final MetricFactory metrics;

    public SessionAuthority(
            IdentityStore identities,
            RevocationStore revocations,
            CredentialHasher hasher,
            TokenCodec codec,
            Duration accessTtl,
            Duration refreshTtl,
            Clock clock,
            MetricFactory metrics) {
        if (accessTtl.isNegative() || accessTtl.isZero()) {
            throw new IllegalArgumentException("accessTtl must be positive");
        }
        if (refreshTtl.compareTo(accessTtl) < 0) {
            throw new IllegalArgumentException("refreshTtl must not be shorter than accessTtl");
        }
        this.identities = identities;
        this.revocations = revocations;
        this.hasher = hasher;
        this.codec = codec;
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Verifies credentials and issues a token pair.
     *
     * @param tenantId tenant to authenticate into; when null, a user with exactly one binding
     *     gets that tenant and anyone else gets tenant-agnostic tokens
     * @throws InvalidCredentialsException unknown email or wrong password
     * @throws InactiveUserException correct password for a deactivated account
     * @throws ForbiddenException {@code tenantId} given but the user has no binding there
     */
    public TokenPair login(String email, String password, UUID tenantId) {
        String masked = SensitiveDataRedactor.maskEmail(email);
        Optional<User> found = email == null ? Optional.empty() : identities.findUserByEmail(email);
        if (found.isEmpty()) {
            hasher.dummyVerify(password == null ? "" : password);
            return loginFailed(masked, "unknown email");
        }
        User user = found.get();
        if (password == null || !hasher.verify(password, user.passwordHash())) {
            return loginFailed(masked, "wrong password");
        }
        if (!user.active()) {
            metrics.recordOutcome(METRIC_LOGIN, "inactive");
            log.warn("Login rejected for {}: account inactive", masked);
            throw new InactiveUserException();
        }

        TenantScope scope = resolveScope(user.id(), tenantId);
        TokenPair pair = issuePair(user.id().toString(), scope.tenantId(), scope.role());
        metrics.recordOutcome(METRIC_LOGIN, "success");
        log.info(
                "Login succeeded for user {} (tenant {})",
                user.id(),
                scope.tenantId() == null ? "none" : scope.tenantId());
        return pair;
    }

    /**
     * Rotates a refresh token: the presented token is revoked and a new pair with the same
     * subject, tenant and role is issued.
     *
     * @throws TokenException the token is malformed, forged, expired or not a refresh token
     * @throws RevokedTokenException the token was already used or revoked
     * @throws InvalidCredentialsException the subject no longer exists
     * @throws InactiveUserException the subject has been deactivated
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = codec.decode(refreshToken, TokenType.REFRESH);
        } catch (TokenException e) {
            metrics.recordOutcome(METRIC_REFRESH, "rejected");
            log.info("Refresh rejected: {}", e.getMessage());
            throw e;
        }

        if (revocations.isRevoked(claims.jti())
                || !revocations.revokeIfAbsent(
                        new RevocationRecord(claims.jti(), clock.instant(), claims.expiresAt()))) {
            metrics.recordOutcome(METRIC_REFRESH, "revoked");
            log.warn("Refresh token {} for user {} was reused", claims.jti(), claims.subject());
            throw new RevokedTokenException(claims.jti());
        }

        UUID userId = AuthorizationEvaluator.parse(claims.subject());
        Optional<User> user = userId == null ? Optional.empty() : identities.findUserById(userId);
        if (user.isEmpty()) {
            metrics.recordOutcome(METRIC_REFRESH, "unknown_user");
            throw new InvalidCredentialsException();
        }
        if (!user.get().active()) {
            metrics.recordOutcome(METRIC_REFRESH, "inactive");
            throw new InactiveUserException();
        }

        TokenPair pair = issuePair(claims.subject(), claims.tenantId(), claims.role());
        metrics.recordOutcome(METRIC_REFRESH, "success");
        log.debug("Rotated refresh token {} -> {}", claims.jti(), pair.refreshClaims().jti());
        return pair;
    }

    /** Stateless validation of an access token. */
    public TokenClaims validateAccess(String accessToken) {
        return codec.decode(accessToken, TokenType.ACCESS);
    }

    /**
     * Extracts and validates the bearer token of an {@code Authorization} header, then binds the
     * principal to the logging context.
     *
     * @throws MissingCredentialsException no bearer credential was presented
     */
    public TokenClaims authenticate(String authorizationHeader) {
        String token =
                BearerTokenExtractor.extract(authorizationHeader)
                        .orElseThrow(MissingCredentialsException::new);
        TokenClaims claims = validateAccess(token);
        CorrelationContextHolder.bindPrincipal(claims.subject(), claims.tenantId());
        return claims;
    }

    /**
     * Marks a refresh token id as revoked. Revoking an already revoked id is a no-op.
     *
     * @param expiresAt the token's own expiry, after which the record may be purged
     */
    public void revoke(String jti, Instant expiresAt) {
        if (revocations.revokeIfAbsent(new RevocationRecord(jti, clock.instant(), expiresAt))) {
            log.info("Revoked refresh token {}", jti);
        } else {
            log.debug("Refresh token {} was already revoked", jti);
        }
    }

    /**
     * Ends a session by revoking its refresh token. An already expired token is accepted as
     * logged out.
     */
    public void logout(String refreshToken) {
        TokenClaims claims;
        try {
            claims = codec.decode(refreshToken, TokenType.REFRESH);
        } catch (ExpiredTokenException e) {
            log.debug("Logout with an expired refresh token; nothing to revoke");
            return;
        }
        revoke(claims.jti(), claims.expiresAt());
    }

    /** Deletes revocation records of tokens that have expired anyway. */
    public int purgeExpiredRevocations() {
        int purged = revocations.purgeExpired(clock.instant());
        if (purged > 0) {
            log.info("Purged {} expired revocation records", purged);
        }
        return purged;
    }

    private TokenPair loginFailed(String maskedEmail, String reason) {
        metrics.recordOutcome(METRIC_LOGIN, "invalid_credentials");
        log.info("Login failed for {}: {}", maskedEmail, reason);
        throw new InvalidCredentialsException();
    }

    private TenantScope resolveScope(UUID userId, UUID requestedTenantId) {
        if (requestedTenantId != null) {
            Role role =
                    identities
                            .findBinding(requestedTenantId, userId)
                            .orElseThrow(
                                    () -> {
                                        metrics.recordOutcome(METRIC_LOGIN, "no_membership");
                                        return new ForbiddenException(
                                                "User is not a member of the requested tenant");
                                    });
            return new TenantScope(requestedTenantId.toString(), role);
        }
        List<RoleBinding> bindings = identities.listBindingsForUser(userId);
        if (bindings.size() == 1) {
            RoleBinding only = bindings.get(0);
            return new TenantScope(only.tenantId().toString(), only.role());
        }
        return new TenantScope(null, null);
    }

    private TokenPair issuePair(String subject, String tenantId, Role role) {
        Instant now = clock.instant();
        TokenClaims access =
                TokenClaims.mint(subject, tenantId, role, TokenType.ACCESS, now, accessTtl);
        TokenClaims refresh =
                TokenClaims.mint(subject, tenantId, role, TokenType.REFRESH, now, refreshTtl);
        return new TokenPair(codec.issue(access), codec.issue(refresh), access, refresh);
    }

    private record TenantScope(String tenantId, Role role) {}
}
