package com.aegis.security;

import java.time.Instant;

/**
 * Thrown when a correctly signed token is presented at or after its expiry instant.
 */
public class ExpiredTokenException extends TokenException {

    private final Instant expiredAt;

    public ExpiredTokenException(Instant expiredAt) {
        super("Token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
