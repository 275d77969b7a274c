package com.aegis.authservice.infrastructure.memory;

import com.aegis.authservice.domain.error.DuplicateEmailException;
import com.aegis.authservice.domain.error.NotFoundException;
import com.aegis.authservice.domain.model.Emails;
import com.aegis.authservice.domain.model.RoleBinding;
import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link IdentityStore} held in memory, for local runs and tests.
 *
 * <p>Reads are lock-free. Writes that must keep cross-map invariants (email index, referential
 * integrity of bindings) take the store's monitor; email uniqueness itself is decided by {@link
 * ConcurrentHashMap#putIfAbsent} on the normalized address.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<UUID, User> users = new ConcurrentHashMap<>();
    private final Map<String, UUID> usersByEmail = new ConcurrentHashMap<>();
    private final Map<UUID, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<BindingKey, RoleBinding> bindings = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdentityStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized User createUser(String email, String passwordHash, String fullName) {
        UUID id = UUID.randomUUID();
        if (usersByEmail.putIfAbsent(Emails.normalize(email), id) != null) {
            throw new DuplicateEmailException();
        }
        User user = new User(id, email, passwordHash, fullName, now(), true);
        users.put(id, user);
        return user;
    }

    @Override
    public Optional<User> findUserById(UUID userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        return Optional.ofNullable(usersByEmail.get(Emails.normalize(email))).map(users::get);
    }

    @Override
    public User setUserActive(UUID userId, boolean active) {
        return updateUser(userId, u -> u.withActive(active));
    }

    @Override
    public User updatePasswordHash(UUID userId, String passwordHash) {
        return updateUser(userId, u -> u.withPasswordHash(passwordHash));
    }

    @Override
    public User updateFullName(UUID userId, String fullName) {
        return updateUser(userId, u -> u.withFullName(fullName));
    }

    @Override
    public synchronized boolean deleteUser(UUID userId) {
        User removed = users.remove(userId);
        if (removed == null) {
            return false;
        }
        usersByEmail.remove(removed.normalizedEmail(), userId);
        bindings.keySet().removeIf(k -> k.userId().equals(userId));
        return true;
    }

    @Override
    public Tenant createTenant(String name) {
        Tenant tenant = new Tenant(UUID.randomUUID(), name, now());
        tenants.put(tenant.id(), tenant);
        return tenant;
    }

    @Override
    public Optional<Tenant> findTenant(UUID tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Tenant renameTenant(UUID tenantId, String name) {
        Tenant renamed = tenants.computeIfPresent(tenantId, (id, t) -> t.withName(name));
        if (renamed == null) {
            throw NotFoundException.tenant(tenantId);
        }
        return renamed;
    }

    @Override
    public synchronized boolean deleteTenant(UUID tenantId) {
        if (tenants.remove(tenantId) == null) {
            return false;
        }
        bindings.keySet().removeIf(k -> k.tenantId().equals(tenantId));
        return true;
    }

    @Override
    public synchronized RoleBinding bind(UUID tenantId, UUID userId, Role role) {
        if (!tenants.containsKey(tenantId)) {
            throw NotFoundException.tenant(tenantId);
        }
        if (!users.containsKey(userId)) {
            throw NotFoundException.user(userId);
        }
        RoleBinding binding = new RoleBinding(tenantId, userId, role, now());
        bindings.put(new BindingKey(tenantId, userId), binding);
        return binding;
    }

    @Override
    public boolean unbind(UUID tenantId, UUID userId) {
        return bindings.remove(new BindingKey(tenantId, userId)) != null;
    }

    @Override
    public Optional<Role> findBinding(UUID tenantId, UUID userId) {
        return Optional.ofNullable(bindings.get(new BindingKey(tenantId, userId)))
                .map(RoleBinding::role);
    }

    @Override
    public List<RoleBinding> listBindings(UUID tenantId) {
        return bindings.values().stream()
                .filter(b -> b.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(RoleBinding::userId))
                .toList();
    }

    @Override
    public List<RoleBinding> listBindingsForUser(UUID userId) {
        return bindings.values().stream()
                .filter(b -> b.userId().equals(userId))
                .sorted(Comparator.comparing(RoleBinding::tenantId))
                .toList();
    }

    private User updateUser(UUID userId, UnaryOperator<User> change) {
        User updated = users.computeIfPresent(userId, (id, u) -> change.apply(u));
        if (updated == null) {
            throw NotFoundException.user(userId);
        }
        return updated;
    }

    private Instant now() {
        return clock.instant();
    }

    private record BindingKey(UUID tenantId, UUID userId) {}
}
