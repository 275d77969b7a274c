package com.aegis.authservice.domain.model;

import com.aegis.security.TokenClaims;

import java.time.Duration;

/**
 * An access token and the refresh token minted alongside it.
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        TokenClaims accessClaims,
        TokenClaims refreshClaims
) {

    /** Lifetime of the access token in whole seconds. */
    public long accessExpiresInSeconds() {
        return Duration.between(accessClaims.issuedAt(), accessClaims.expiresAt()).toSeconds();
    }

    @Override
    public String toString() {
        return "TokenPair[subject=" + accessClaims.subject()
                + ", tenant=" + accessClaims.tenantId()
                + ", refreshJti=" + refreshClaims.jti() + "]";
    }
}
