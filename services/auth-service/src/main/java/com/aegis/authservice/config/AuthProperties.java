package com.aegis.authservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token and credential settings, bound from {@code aegis.auth.*}.
 *
 * <p>The signing secret has no default and is normally supplied through {@code
 * AEGIS_JWT_SECRET}. HMAC algorithms need a secret at least as long as the hash output (32 bytes
 * for HS256); a shorter one fails startup.
 *
 * @param issuer value of the {@code iss} claim; tokens from other issuers are rejected
 * @param signingAlgorithm HS256, HS384 or HS512
 * @param signingSecret shared HMAC secret
 * @param accessTokenTtl lifetime of access tokens (default 30 minutes)
 * @param refreshTokenTtl lifetime of refresh tokens (default 7 days)
 * @param bcryptStrength BCrypt log2 cost (default 10)
 * @param revocationPurgeInterval delay between purges of expired revocation records
 */
@ConfigurationProperties(prefix = "aegis.auth")
@Validated
public record AuthProperties(
        String issuer,
        String signingAlgorithm,
        @NotBlank String signingSecret,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        @Min(4) @Max(31) Integer bcryptStrength,
        Duration revocationPurgeInterval) {

    public static final String DEFAULT_ISSUER = "aegis-auth";

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
        if (signingAlgorithm == null || signingAlgorithm.isBlank()) {
            signingAlgorithm = "HS256";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(30);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(7);
        }
        if (bcryptStrength == null) {
            bcryptStrength = 10;
        }
        if (revocationPurgeInterval == null) {
            revocationPurgeInterval = Duration.ofHours(1);
        }
    }
}
