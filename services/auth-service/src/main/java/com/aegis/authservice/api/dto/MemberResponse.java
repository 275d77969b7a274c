package com.aegis.authservice.api.dto;

import com.aegis.authservice.domain.model.RoleBinding;
import java.time.Instant;
import java.util.UUID;

public record MemberResponse(UUID tenantId, UUID userId, String role, Instant updatedAt) {

    public static MemberResponse from(RoleBinding binding) {
        return new MemberResponse(
                binding.tenantId(), binding.userId(), binding.role().value(), binding.updatedAt());
    }
}
