package com.aegis.authservice.api.dto;

import com.aegis.authservice.domain.model.UserProfile;
import java.util.UUID;

/** Tenant and role are null for a tenant-agnostic token. */
public record UserProfileResponse(
        UUID userId, String email, String fullName, String tenantId, String role) {

    public static UserProfileResponse from(UserProfile profile) {
        return new UserProfileResponse(
                profile.userId(),
                profile.email(),
                profile.fullName(),
                profile.tenantId(),
                profile.role() == null ? null : profile.role().value());
    }
}
