package com.aegis.authservice.api.dto;

import com.aegis.authservice.domain.model.Registration;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationResponse(UUID userId, UUID tenantId) {

    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(registration.userId(), registration.tenantId());
    }
}
