package com.aegis.authservice.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A platform identity. Exists independently of any tenant; membership is expressed only
 * through {@link RoleBinding}s.
 *
 * @param id           unique user id
 * @param email        address as registered (uniqueness is on {@link Emails#normalize})
 * @param passwordHash opaque credential hash
 * @param fullName     optional display name
 * @param createdAt    registration instant
 * @param active       false once the account is deactivated (soft delete)
 */
public record User(
        UUID id,
        String email,
        String passwordHash,
        String fullName,
        Instant createdAt,
        boolean active
) {

    public String normalizedEmail() {
        return Emails.normalize(email);
    }

    public User withActive(boolean value) {
        return new User(id, email, passwordHash, fullName, createdAt, value);
    }

    public User withPasswordHash(String value) {
        return new User(id, email, value, fullName, createdAt, active);
    }

    public User withFullName(String value) {
        return new User(id, email, passwordHash, value, createdAt, active);
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", active=" + active + "]";
    }
}
