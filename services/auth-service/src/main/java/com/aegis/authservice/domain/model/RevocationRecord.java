package com.aegis.authservice.domain.model;

import java.time.Instant;

/**
 * Marks a refresh token as spent. {@code expiresAt} is copied from the token so the record
 * can be purged once the token could no longer be presented anyway.
 */
public record RevocationRecord(String jti, Instant revokedAt, Instant expiresAt) {

    public boolean isPurgeableAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
