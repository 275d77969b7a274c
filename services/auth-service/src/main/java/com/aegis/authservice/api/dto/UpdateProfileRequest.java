package com.aegis.authservice.api.dto;

import jakarta.validation.constraints.Size;

/** Body of {@code PATCH /users/me}. A null or blank {@code fullName} clears the name. */
public record UpdateProfileRequest(@Size(max = 200) String fullName) {}
