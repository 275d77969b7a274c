package com.aegis.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant-scoped roles, totally ordered {@code OWNER > ADMIN > MEMBER}.
 * <p>
 * The ordering is the static table in {@link #impliedRoles()}: a role satisfies a requirement
 * for itself and for every role it implies. Nothing is computed from strings at runtime.
 */
public enum Role {

    MEMBER("member"),
    ADMIN("admin"),
    OWNER("owner");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical wire representation (e.g., "owner"). */
    public String value() {
        return value;
    }

    /**
     * Returns the roles this role grants in addition to itself.
     * <ul>
     *   <li>OWNER implies ADMIN, MEMBER</li>
     *   <li>ADMIN implies MEMBER</li>
     *   <li>MEMBER implies nothing</li>
     * </ul>
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case OWNER -> EnumSet.of(ADMIN, MEMBER);
            case ADMIN -> EnumSet.of(MEMBER);
            case MEMBER -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether holding this role is enough for an operation that requires {@code required}.
     */
    public boolean satisfies(Role required) {
        return required != null && (this == required || impliedRoles().contains(required));
    }

    /**
     * Looks up a Role by its wire value, ignoring case ("OWNER" and "owner" both match).
     *
     * @param value the string to match (may be null)
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
