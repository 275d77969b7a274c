package com.aegis.authservice.infrastructure.persistence;

import static com.aegis.authservice.infrastructure.persistence.JdbcSupport.guarded;
import static com.aegis.authservice.infrastructure.persistence.JdbcSupport.toTimestamp;

import com.aegis.authservice.domain.model.RevocationRecord;
import com.aegis.authservice.domain.port.RevocationStore;
import java.time.Duration;
import java.time.Instant;
import javax.sql.DataSource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link RevocationStore} on the {@code revoked_tokens} table. The primary key on {@code jti}
 * is the compare-and-set: of concurrent inserts for one jti exactly one commits.
 */
public class JdbcRevocationStore implements RevocationStore {

    private final JdbcTemplate jdbc;

    public JdbcRevocationStore(DataSource dataSource, Duration queryTimeout) {
        this.jdbc = JdbcSupport.template(dataSource, queryTimeout);
    }

    @Override
    public boolean revokeIfAbsent(RevocationRecord record) {
        return guarded(
                "revokeIfAbsent",
                () -> {
                    try {
                        jdbc.update(
                                "INSERT INTO revoked_tokens (jti, revoked_at, expires_at) VALUES (?, ?, ?)",
                                record.jti(),
                                toTimestamp(record.revokedAt()),
                                toTimestamp(record.expiresAt()));
                        return true;
                    } catch (DuplicateKeyException e) {
                        return false;
                    }
                });
    }

    @Override
    public boolean isRevoked(String jti) {
        return guarded(
                "isRevoked",
                () -> {
                    Integer count =
                            jdbc.queryForObject(
                                    "SELECT COUNT(*) FROM revoked_tokens WHERE jti = ?",
                                    Integer.class,
                                    jti);
                    return count != null && count > 0;
                });
    }

    @Override
    public int purgeExpired(Instant now) {
        return guarded(
                "purgeExpired",
                () ->
                        jdbc.update(
                                "DELETE FROM revoked_tokens WHERE expires_at <= ?",
                                toTimestamp(now)));
    }
}
