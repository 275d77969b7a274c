package com.aegis.authservice;

import com.aegis.authservice.config.AuthProperties;
import com.aegis.authservice.config.ServiceProperties;
import com.aegis.authservice.config.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Aegis auth service: registration, login, token refresh and tenant administration.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation and principal-aware log context
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Flyway schema migrations on startup ({@code aegis.store.mode=jdbc})
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    ServiceProperties.class,
    AuthProperties.class,
    StoreProperties.class
})
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Aegis auth service started successfully");
    }
}
