package com.aegis.authservice.infrastructure.persistence;

import com.aegis.authservice.domain.error.StoreUnavailableException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/** Shared plumbing for the JDBC stores. */
final class JdbcSupport {

    private JdbcSupport() {
        // utility class
    }

    /** A template whose every statement carries {@code queryTimeout}. */
    static JdbcTemplate template(DataSource dataSource, Duration queryTimeout) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        return jdbc;
    }

    /**
     * Runs {@code call}, turning timeouts and connection failures into {@link
     * StoreUnavailableException}. Other data access exceptions propagate unchanged.
     */
    static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        }
    }

    static OffsetDateTime toTimestamp(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
