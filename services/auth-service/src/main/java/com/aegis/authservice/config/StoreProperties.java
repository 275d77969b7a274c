package com.aegis.authservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Persistence settings, bound from {@code aegis.store.*}.
 *
 * @param mode {@code jdbc} (default) or {@code memory}
 * @param queryTimeout per-statement timeout for JDBC stores (default 5 seconds)
 */
@ConfigurationProperties(prefix = "aegis.store")
public record StoreProperties(String mode, Duration queryTimeout) {

    public StoreProperties {
        if (mode == null || mode.isBlank()) {
            mode = "jdbc";
        }
        if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
            queryTimeout = Duration.ofSeconds(5);
        }
    }
}
