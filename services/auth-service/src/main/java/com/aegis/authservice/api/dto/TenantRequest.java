package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /tenants} and {@code PATCH /tenants/{id}}. */
public record TenantRequest(@NotBlank @Size(max = 200) String name) {}
