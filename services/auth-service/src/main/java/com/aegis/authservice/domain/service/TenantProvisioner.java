package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a tenant and binds its first owner as one logical unit. If the binding fails, the
 * tenant is deleted again so no tenant is ever left without an owner.
 */
public class TenantProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TenantProvisioner.class);

    private final IdentityStore identities;

    public TenantProvisioner(IdentityStore identities) {
        this.identities = identities;
    }

    public Tenant provision(String name, UUID ownerId) {
        String validName = validateName(name);
        Tenant tenant = identities.createTenant(validName);
        try {
            identities.bind(tenant.id(), ownerId, Role.OWNER);
        } catch (RuntimeException e) {
            log.warn("Binding owner {} to new tenant {} failed; deleting tenant", ownerId, tenant.id());
            try {
                identities.deleteTenant(tenant.id());
            } catch (RuntimeException cleanup) {
                log.error("Could not delete orphaned tenant {}", tenant.id(), cleanup);
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.info("Provisioned tenant {} owned by {}", tenant.id(), ownerId);
        return tenant;
    }

    /**
     * @return the stripped name
     * @throws IllegalArgumentException if blank or too long
     */
    static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tenant name must not be blank");
        }
        String stripped = name.strip();
        if (stripped.length() > Tenant.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Tenant name must be at most " + Tenant.MAX_NAME_LENGTH + " characters");
        }
        return stripped;
    }
}
