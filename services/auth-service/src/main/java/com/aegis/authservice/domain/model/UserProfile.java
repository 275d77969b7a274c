package com.aegis.authservice.domain.model;

import com.aegis.security.Role;

import java.util.UUID;

/**
 * The authenticated caller as seen through their access token: identity from the store,
 * tenant and role from the validated claims.
 */
public record UserProfile(UUID userId, String email, String fullName, String tenantId, Role role) {
}
