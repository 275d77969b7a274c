package com.aegis.authservice.config;

import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.authservice.domain.port.RevocationStore;
import com.aegis.authservice.domain.service.AuthorizationEvaluator;
import com.aegis.authservice.domain.service.RegistrationService;
import com.aegis.authservice.domain.service.SessionAuthority;
import com.aegis.authservice.domain.service.TenantAdminService;
import com.aegis.authservice.domain.service.TenantProvisioner;
import com.aegis.authservice.domain.service.UserAccountService;
import com.aegis.observability.MetricFactory;
import com.aegis.security.BCryptCredentialHasher;
import com.aegis.security.CredentialHasher;
import com.aegis.security.JwtTokenCodec;
import com.aegis.security.TokenCodec;
import com.nimbusds.jose.JWSAlgorithm;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Wires the Spring-free auth core from typed configuration.
 *
 * <p>Domain services are plain classes; this is the only place that knows how they are
 * assembled. Store implementations come from {@link PersistenceConfig}.
 */
@Configuration
@EnableScheduling
public class AuthServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialHasher credentialHasher(AuthProperties auth) {
        return new BCryptCredentialHasher(auth.bcryptStrength());
    }

    @Bean
    public TokenCodec tokenCodec(AuthProperties auth, Clock clock) {
        return JwtTokenCodec.hmac(
                JWSAlgorithm.parse(auth.signingAlgorithm()),
                auth.signingSecret().getBytes(StandardCharsets.UTF_8),
                auth.issuer(),
                clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SessionAuthority sessionAuthority(
            IdentityStore identities,
            RevocationStore revocations,
            CredentialHasher hasher,
            TokenCodec codec,
            AuthProperties auth,
            Clock clock,
            MetricFactory metrics) {
        return new SessionAuthority(
                identities,
                revocations,
                hasher,
                codec,
                auth.accessTokenTtl(),
                auth.refreshTokenTtl(),
                clock,
                metrics);
    }

    @Bean
    public AuthorizationEvaluator authorizationEvaluator(IdentityStore identities) {
        return new AuthorizationEvaluator(identities);
    }

    @Bean
    public TenantProvisioner tenantProvisioner(IdentityStore identities) {
        return new TenantProvisioner(identities);
    }

    @Bean
    public RegistrationService registrationService(
            IdentityStore identities,
            CredentialHasher hasher,
            TenantProvisioner provisioner,
            MetricFactory metrics) {
        return new RegistrationService(identities, hasher, provisioner, metrics);
    }

    @Bean
    public TenantAdminService tenantAdminService(
            IdentityStore identities,
            AuthorizationEvaluator authorization,
            TenantProvisioner provisioner) {
        return new TenantAdminService(identities, authorization, provisioner);
    }

    @Bean
    public UserAccountService userAccountService(IdentityStore identities, CredentialHasher hasher) {
        return new UserAccountService(identities, hasher);
    }
}
