package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /auth/register}. {@code fullName} and {@code tenantName} are optional. */
public record RegisterRequest(
        @NotBlank @Size(max = 320) String email,
        @NotBlank String password,
        @Size(max = 200) String fullName,
        @Size(max = 200) String tenantName) {}
