package com.aegis.authservice.api.dto;

import com.aegis.authservice.domain.model.Tenant;
import java.time.Instant;
import java.util.UUID;

public record TenantResponse(UUID id, String name, Instant createdAt) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(tenant.id(), tenant.name(), tenant.createdAt());
    }
}
