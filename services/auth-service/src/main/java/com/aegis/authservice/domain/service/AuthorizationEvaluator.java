package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.error.ForbiddenException;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import com.aegis.security.TenantIsolationEnforcer;
import com.aegis.security.TokenClaims;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "may this user act with at least role R in tenant T" from the stored role bindings.
 *
 * <p>Deny by default: no binding, no tenant, or an unparseable id all deny. The tenant always
 * comes from validated token claims; a tenant id taken from a request path is only ever
 * compared against the token's tenant via {@link TenantIsolationEnforcer}.
 */
public class AuthorizationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEvaluator.class);

    private final IdentityStore identities;

    public AuthorizationEvaluator(IdentityStore identities) {
        this.identities = identities;
    }

    /** Point lookup of the binding, then the static role ordering. */
    public boolean can(UUID userId, UUID tenantId, Role required) {
        if (userId == null || tenantId == null || required == null) {
            return false;
        }
        return identities
                .findBinding(tenantId, userId)
                .map(held -> held.satisfies(required))
                .orElse(false);
    }

    /**
     * Requires {@code required} in the tenant the claims were issued for.
     *
     * @return the role the caller actually holds there
     * @throws ForbiddenException if the token is tenant-agnostic or the stored role is too low
     */
    public Role require(TokenClaims claims, Role required) {
        if (!claims.isTenantScoped()) {
            throw new ForbiddenException("Access token is not scoped to a tenant");
        }
        UUID tenantId = parse(claims.tenantId());
        UUID userId = parse(claims.subject());
        Optional<Role> held =
                tenantId == null || userId == null
                        ? Optional.empty()
                        : identities.findBinding(tenantId, userId);
        if (held.isEmpty() || !held.get().satisfies(required)) {
            log.info(
                    "Denied: user {} needs {} in tenant {}, holds {}",
                    claims.subject(),
                    required.value(),
                    claims.tenantId(),
                    held.map(Role::value).orElse("none"));
            throw new ForbiddenException("Requires role " + required.value() + " in this tenant");
        }
        return held.get();
    }

    /**
     * Checks that {@code pathTenantId} is the token's tenant, then {@link #require}s the role.
     *
     * @throws com.aegis.security.TenantMismatchException if the ids differ
     */
    public Role requireInTenant(TokenClaims claims, UUID pathTenantId, Role required) {
        TenantIsolationEnforcer.enforce(claims, pathTenantId.toString());
        return require(claims, required);
    }

    static UUID parse(String id) {
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring non-UUID identifier '{}'", id);
            return null;
        }
    }
}
