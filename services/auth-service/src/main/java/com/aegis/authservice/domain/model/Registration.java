package com.aegis.authservice.domain.model;

import java.util.UUID;

/**
 * Result of a registration: the new user and, if one was requested, the tenant they own.
 */
public record Registration(UUID userId, UUID tenantId) {
}
