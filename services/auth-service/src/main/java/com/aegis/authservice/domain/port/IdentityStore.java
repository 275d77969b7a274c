package com.aegis.authservice.domain.port;

import com.aegis.authservice.domain.error.DuplicateEmailException;
import com.aegis.authservice.domain.error.NotFoundException;
import com.aegis.authservice.domain.model.RoleBinding;
import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.model.User;
import com.aegis.security.Role;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable records for tenants, users and tenant-user role bindings.
 * <p>
 * Implementations must keep these guarantees under concurrent callers:
 * <ul>
 *   <li>email uniqueness is global and case-insensitive; of two concurrent registrations for
 *       the same address exactly one succeeds</li>
 *   <li>at most one binding per (tenant, user); {@link #bind} overwrites</li>
 *   <li>a binding never references a missing tenant or user; deleting either removes its
 *       bindings</li>
 * </ul>
 * Any call may throw {@link com.aegis.authservice.domain.error.StoreUnavailableException}
 * when the backing store times out.
 */
public interface IdentityStore {

    // ── Users ──

    /**
     * @throws DuplicateEmailException if the normalized email is taken
     */
    User createUser(String email, String passwordHash, String fullName);

    Optional<User> findUserById(UUID userId);

    /** Case-insensitive lookup. */
    Optional<User> findUserByEmail(String email);

    /**
     * @throws NotFoundException if the user does not exist
     */
    User setUserActive(UUID userId, boolean active);

    /**
     * @throws NotFoundException if the user does not exist
     */
    User updatePasswordHash(UUID userId, String passwordHash);

    /**
     * @param fullName new display name, or null to clear it
     * @throws NotFoundException if the user does not exist
     */
    User updateFullName(UUID userId, String fullName);

    /**
     * Physically deletes a user and their bindings. Reserved for explicit admin requests and
     * for undoing a half-finished registration.
     *
     * @return true if a user was deleted
     */
    boolean deleteUser(UUID userId);

    // ── Tenants ──

    /** Always succeeds; tenant names need not be unique. */
    Tenant createTenant(String name);

    Optional<Tenant> findTenant(UUID tenantId);

    /**
     * @throws NotFoundException if the tenant does not exist
     */
    Tenant renameTenant(UUID tenantId, String name);

    /**
     * Deletes a tenant and, by cascade, its bindings. Users are untouched.
     *
     * @return true if a tenant was deleted
     */
    boolean deleteTenant(UUID tenantId);

    // ── Bindings ──

    /**
     * Creates or overwrites the binding for (tenant, user).
     *
     * @throws NotFoundException if the tenant or the user does not exist
     */
    RoleBinding bind(UUID tenantId, UUID userId, Role role);

    /**
     * @return true if a binding was removed
     */
    boolean unbind(UUID tenantId, UUID userId);

    /**
     * Point lookup on the authorization hot path.
     */
    Optional<Role> findBinding(UUID tenantId, UUID userId);

    List<RoleBinding> listBindings(UUID tenantId);

    List<RoleBinding> listBindingsForUser(UUID userId);
}
