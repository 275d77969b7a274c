package com.aegis.authservice.domain.error;

import java.util.UUID;

public class NotFoundException extends AuthServiceException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException user(UUID userId) {
        return new NotFoundException("User " + userId + " not found");
    }

    public static NotFoundException tenant(UUID tenantId) {
        return new NotFoundException("Tenant " + tenantId + " not found");
    }

    public static NotFoundException binding(UUID tenantId, UUID userId) {
        return new NotFoundException("User " + userId + " is not a member of tenant " + tenantId);
    }
}
