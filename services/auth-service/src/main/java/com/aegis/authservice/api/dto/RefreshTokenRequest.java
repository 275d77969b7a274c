package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /auth/refresh} and {@code POST /auth/logout}. */
public record RefreshTokenRequest(@NotBlank String refreshToken) {}
