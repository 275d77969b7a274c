package com.aegis.authservice.domain.model;

import com.aegis.security.Role;

import java.time.Instant;
import java.util.UUID;

/**
 * The {@code (tenant, user) -> role} association; the unit of authorization. At most one
 * exists per pair.
 */
public record RoleBinding(UUID tenantId, UUID userId, Role role, Instant updatedAt) {
}
