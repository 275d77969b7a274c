package com.aegis.authservice.api;

import com.aegis.authservice.config.ServiceProperties;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight, unauthenticated info endpoint for operational checks. Actuator's {@code
 * /actuator/info} carries build metadata; this one reports the configured service identity.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final Clock clock;

    public ServiceInfoController(ServiceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", clock.instant().toString());
    }
}
