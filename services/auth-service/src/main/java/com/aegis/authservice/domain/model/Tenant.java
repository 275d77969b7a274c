package com.aegis.authservice.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A tenant. Names are display labels and need not be unique.
 */
public record Tenant(UUID id, String name, Instant createdAt) {

    public static final int MAX_NAME_LENGTH = 200;

    public Tenant withName(String value) {
        return new Tenant(id, value, createdAt);
    }
}
