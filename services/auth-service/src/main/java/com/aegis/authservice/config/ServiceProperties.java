package com.aegis.authservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service instance, bound from {@code aegis.service.*}.
 *
 * <pre>
 * aegis:
 *   service:
 *     name: auth-service
 *     environment: production
 *     description: Tenant-aware credential service
 * </pre>
 *
 * @param name service name used as the {@code service} tag on every metric. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description shown by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "aegis.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
