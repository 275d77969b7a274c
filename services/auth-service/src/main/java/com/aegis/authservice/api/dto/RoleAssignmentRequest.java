package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /tenants/{tenantId}/members/{userId}}: one of owner, admin, member. */
public record RoleAssignmentRequest(@NotBlank String role) {}
