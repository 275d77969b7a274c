package com.aegis.authservice.infrastructure.persistence;

import static com.aegis.authservice.infrastructure.persistence.JdbcSupport.guarded;
import static com.aegis.authservice.infrastructure.persistence.JdbcSupport.instant;
import static com.aegis.authservice.infrastructure.persistence.JdbcSupport.toTimestamp;

import com.aegis.authservice.domain.error.DuplicateEmailException;
import com.aegis.authservice.domain.error.InternalErrorException;
import com.aegis.authservice.domain.error.NotFoundException;
import com.aegis.authservice.domain.model.Emails;
import com.aegis.authservice.domain.model.RoleBinding;
import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link IdentityStore} on the {@code tenants}, {@code users} and {@code role_bindings} tables.
 *
 * <p>Uniqueness and referential integrity are left to the schema: the unique index on {@code
 * users.email_normalized} decides concurrent registrations, and foreign keys with {@code ON
 * DELETE CASCADE} remove bindings together with their tenant or user.
 */
public class JdbcIdentityStore implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdentityStore.class);

    private static final String USER_COLUMNS =
            "id, email, password_hash, full_name, created_at, active";

    private static final RowMapper<User> USER_ROW =
            (rs, rowNum) ->
                    new User(
                            rs.getObject("id", UUID.class),
                            rs.getString("email"),
                            rs.getString("password_hash"),
                            rs.getString("full_name"),
                            instant(rs, "created_at"),
                            rs.getBoolean("active"));

    private static final RowMapper<Tenant> TENANT_ROW =
            (rs, rowNum) ->
                    new Tenant(
                            rs.getObject("id", UUID.class),
                            rs.getString("name"),
                            instant(rs, "created_at"));

    private static final RowMapper<RoleBinding> BINDING_ROW =
            (rs, rowNum) ->
                    new RoleBinding(
                            rs.getObject("tenant_id", UUID.class),
                            rs.getObject("user_id", UUID.class),
                            role(rs),
                            instant(rs, "updated_at"));

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcIdentityStore(DataSource dataSource, Duration queryTimeout, Clock clock) {
        this.jdbc = JdbcSupport.template(dataSource, queryTimeout);
        this.clock = clock;
    }

    // ── Users ──

    @Override
    public User createUser(String email, String passwordHash, String fullName) {
        User user = new User(UUID.randomUUID(), email, passwordHash, fullName, now(), true);
        return guarded(
                "createUser",
                () -> {
                    try {
                        jdbc.update(
                                "INSERT INTO users (id, email, email_normalized, password_hash,"
                                        + " full_name, active, created_at)"
                                        + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                                user.id(),
                                user.email(),
                                user.normalizedEmail(),
                                user.passwordHash(),
                                user.fullName(),
                                true,
                                toTimestamp(user.createdAt()));
                    } catch (DuplicateKeyException e) {
                        throw new DuplicateEmailException(e);
                    }
                    return user;
                });
    }

    @Override
    public Optional<User> findUserById(UUID userId) {
        return guarded(
                "findUserById",
                () ->
                        first(
                                jdbc.query(
                                        "SELECT " + USER_COLUMNS + " FROM users WHERE id = ?",
                                        USER_ROW,
                                        userId)));
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        return guarded(
                "findUserByEmail",
                () ->
                        first(
                                jdbc.query(
                                        "SELECT "
                                                + USER_COLUMNS
                                                + " FROM users WHERE email_normalized = ?",
                                        USER_ROW,
                                        Emails.normalize(email))));
    }

    @Override
    public User setUserActive(UUID userId, boolean active) {
        return updateUser("setUserActive", "UPDATE users SET active = ? WHERE id = ?", active, userId);
    }

    @Override
    public User updatePasswordHash(UUID userId, String passwordHash) {
        return updateUser(
                "updatePasswordHash",
                "UPDATE users SET password_hash = ? WHERE id = ?",
                passwordHash,
                userId);
    }

    @Override
    public User updateFullName(UUID userId, String fullName) {
        return updateUser(
                "updateFullName", "UPDATE users SET full_name = ? WHERE id = ?", fullName, userId);
    }

    @Override
    public boolean deleteUser(UUID userId) {
        return guarded(
                "deleteUser", () -> jdbc.update("DELETE FROM users WHERE id = ?", userId) > 0);
    }

    // ── Tenants ──

    @Override
    public Tenant createTenant(String name) {
        Tenant tenant = new Tenant(UUID.randomUUID(), name, now());
        return guarded(
                "createTenant",
                () -> {
                    jdbc.update(
                            "INSERT INTO tenants (id, name, created_at) VALUES (?, ?, ?)",
                            tenant.id(),
                            tenant.name(),
                            toTimestamp(tenant.createdAt()));
                    return tenant;
                });
    }

    @Override
    public Optional<Tenant> findTenant(UUID tenantId) {
        return guarded(
                "findTenant",
                () ->
                        first(
                                jdbc.query(
                                        "SELECT id, name, created_at FROM tenants WHERE id = ?",
                                        TENANT_ROW,
                                        tenantId)));
    }

    @Override
    public Tenant renameTenant(UUID tenantId, String name) {
        return guarded(
                "renameTenant",
                () -> {
                    int rows = jdbc.update("UPDATE tenants SET name = ? WHERE id = ?", name, tenantId);
                    if (rows == 0) {
                        throw NotFoundException.tenant(tenantId);
                    }
                    return findTenant(tenantId).orElseThrow(() -> NotFoundException.tenant(tenantId));
                });
    }

    @Override
    public boolean deleteTenant(UUID tenantId) {
        return guarded(
                "deleteTenant",
                () -> jdbc.update("DELETE FROM tenants WHERE id = ?", tenantId) > 0);
    }

    // ── Bindings ──

    @Override
    public RoleBinding bind(UUID tenantId, UUID userId, Role role) {
        return guarded(
                "bind",
                () -> {
                    if (!exists("SELECT COUNT(*) FROM tenants WHERE id = ?", tenantId)) {
                        throw NotFoundException.tenant(tenantId);
                    }
                    if (!exists("SELECT COUNT(*) FROM users WHERE id = ?", userId)) {
                        throw NotFoundException.user(userId);
                    }
                    RoleBinding binding = new RoleBinding(tenantId, userId, role, now());
                    if (updateBinding(binding) > 0) {
                        return binding;
                    }
                    try {
                        jdbc.update(
                                "INSERT INTO role_bindings (tenant_id, user_id, role, updated_at)"
                                        + " VALUES (?, ?, ?, ?)",
                                tenantId,
                                userId,
                                role.value(),
                                toTimestamp(binding.updatedAt()));
                    } catch (DuplicateKeyException e) {
                        log.debug("Concurrent insert of binding {}/{}; updating", tenantId, userId);
                        updateBinding(binding);
                    } catch (DataIntegrityViolationException e) {
                        throw new NotFoundException(
                                "Tenant " + tenantId + " or user " + userId + " was deleted");
                    }
                    return binding;
                });
    }

    @Override
    public boolean unbind(UUID tenantId, UUID userId) {
        return guarded(
                "unbind",
                () ->
                        jdbc.update(
                                        "DELETE FROM role_bindings WHERE tenant_id = ? AND user_id = ?",
                                        tenantId,
                                        userId)
                                > 0);
    }

    @Override
    public Optional<Role> findBinding(UUID tenantId, UUID userId) {
        return guarded(
                "findBinding",
                () ->
                        first(
                                jdbc.query(
                                        "SELECT role FROM role_bindings"
                                                + " WHERE tenant_id = ? AND user_id = ?",
                                        (rs, rowNum) -> role(rs),
                                        tenantId,
                                        userId)));
    }

    @Override
    public List<RoleBinding> listBindings(UUID tenantId) {
        return guarded(
                "listBindings",
                () ->
                        jdbc.query(
                                "SELECT tenant_id, user_id, role, updated_at FROM role_bindings"
                                        + " WHERE tenant_id = ? ORDER BY user_id",
                                BINDING_ROW,
                                tenantId));
    }

    @Override
    public List<RoleBinding> listBindingsForUser(UUID userId) {
        return guarded(
                "listBindingsForUser",
                () ->
                        jdbc.query(
                                "SELECT tenant_id, user_id, role, updated_at FROM role_bindings"
                                        + " WHERE user_id = ? ORDER BY tenant_id",
                                BINDING_ROW,
                                userId));
    }

    private User updateUser(String operation, String sql, Object value, UUID userId) {
        return guarded(
                operation,
                () -> {
                    if (jdbc.update(sql, value, userId) == 0) {
                        throw NotFoundException.user(userId);
                    }
                    return findUserById(userId).orElseThrow(() -> NotFoundException.user(userId));
                });
    }

    private int updateBinding(RoleBinding binding) {
        return jdbc.update(
                "UPDATE role_bindings SET role = ?, updated_at = ? WHERE tenant_id = ? AND user_id = ?",
                binding.role().value(),
                toTimestamp(binding.updatedAt()),
                binding.tenantId(),
                binding.userId());
    }

    private boolean exists(String countSql, UUID id) {
        Integer count = jdbc.queryForObject(countSql, Integer.class, id);
        return count != null && count > 0;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private static Role role(ResultSet rs) throws SQLException {
        String value = rs.getString("role");
        return Role.fromString(value)
                .orElseThrow(() -> new InternalErrorException("Unknown role in store: " + value));
    }
}
