package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.UUID;

/** Body of {@code POST /auth/login}; {@code tenantId} selects the tenant to log into. */
public record LoginRequest(@NotBlank String email, @NotBlank String password, UUID tenantId) {}
