package com.aegis.security;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Claims carried inside a signed token. Never persisted; they live only in the token itself.
 *
 * @param subject   user id (JWT {@code sub})
 * @param tenantId  tenant the user authenticated into, or null for a tenant-agnostic token
 * @param role      role held in {@code tenantId}; null exactly when {@code tenantId} is null
 * @param tokenType access or refresh
 * @param issuedAt  issue instant, truncated to whole seconds
 * @param expiresAt expiry instant, truncated to whole seconds
 * @param jti       unique token identifier
 */
public record TokenClaims(
        String subject,
        String tenantId,
        Role role,
        TokenType tokenType,
        Instant issuedAt,
        Instant expiresAt,
        String jti
) {

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (tokenType == null) {
            throw new IllegalArgumentException("tokenType must not be null");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt must not be null");
        }
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
        if (jti == null || jti.isBlank()) {
            throw new IllegalArgumentException("jti must not be null or blank");
        }
        if ((tenantId == null) != (role == null)) {
            throw new IllegalArgumentException("tenantId and role must be both present or both absent");
        }
    }

    /**
     * Builds claims for a freshly minted token with a random {@code jti}. Instants are
     * truncated to seconds because JWT NumericDate has second precision.
     */
    public static TokenClaims mint(
            String subject, String tenantId, Role role, TokenType type, Instant now, Duration ttl) {
        Instant issued = Instant.ofEpochSecond(now.getEpochSecond());
        return new TokenClaims(
                subject, tenantId, role, type, issued, issued.plus(ttl), UUID.randomUUID().toString());
    }

    /** True if this token carries a tenant context. */
    public boolean isTenantScoped() {
        return tenantId != null;
    }

    /** True if {@code now} is at or past the expiry instant. */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
