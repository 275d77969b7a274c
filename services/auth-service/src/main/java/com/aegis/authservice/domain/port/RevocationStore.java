package com.aegis.authservice.domain.port;

import com.aegis.authservice.domain.model.RevocationRecord;

import java.time.Instant;

/**
 * Spent and revoked refresh-token ids.
 */
public interface RevocationStore {

    /**
     * Atomically records a revocation unless one already exists for the same {@code jti}.
     * Of any number of concurrent callers with the same jti, exactly one sees {@code true}.
     *
     * @return true if this call created the record
     */
    boolean revokeIfAbsent(RevocationRecord record);

    boolean isRevoked(String jti);

    /**
     * Removes records whose token expiry is at or before {@code now}.
     *
     * @return the number of records removed
     */
    int purgeExpired(Instant now);
}
