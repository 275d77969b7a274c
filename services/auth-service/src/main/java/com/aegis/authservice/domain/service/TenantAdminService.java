package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.error.ForbiddenException;
import com.aegis.authservice.domain.error.InactiveUserException;
import com.aegis.authservice.domain.error.InvalidCredentialsException;
import com.aegis.authservice.domain.error.NotFoundException;
import com.aegis.authservice.domain.model.RoleBinding;
import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.Role;
import com.aegis.security.TokenClaims;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tenant and membership administration on behalf of an authenticated caller.
 *
 * <p>Every tenant-scoped operation authorizes against the tenant of the caller's access token.
 * Owner bindings get extra protection:
 *
 * <ul>
 *   <li>only an owner may grant {@link Role#OWNER} or change or remove an existing owner
 *   <li>the last owner of a tenant can be neither demoted nor removed
 * </ul>
 */
public class TenantAdminService {

    private static final Logger log = LoggerFactory.getLogger(TenantAdminService.class);

    private final IdentityStore identities;
    private final AuthorizationEvaluator authorization;
    private final TenantProvisioner provisioner;

    public TenantAdminService(
            IdentityStore identities,
            AuthorizationEvaluator authorization,
            TenantProvisioner provisioner) {
        this.identities = identities;
        this.authorization = authorization;
        this.provisioner = provisioner;
    }

    /** Any active user may create a tenant and becomes its owner. */
    public Tenant createTenant(TokenClaims caller, String name) {
        User user = activeCaller(caller);
        return provisioner.provision(name, user.id());
    }

    /**
     * Creates or changes a member's role.
     *
     * @throws ForbiddenException the caller lacks ADMIN, or the change touches an owner and the
     *     caller is not one, or it would demote the last owner
     * @throws NotFoundException the target user does not exist
     */
    public RoleBinding assignRole(TokenClaims caller, UUID tenantId, UUID userId, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        Role callerRole = authorization.requireInTenant(caller, tenantId, Role.ADMIN);
        Optional<Role> existing = identities.findBinding(tenantId, userId);

        boolean touchesOwner = role == Role.OWNER || existing.orElse(null) == Role.OWNER;
        if (touchesOwner && callerRole != Role.OWNER) {
            throw new ForbiddenException("Only an owner can grant or change the owner role");
        }
        if (existing.orElse(null) == Role.OWNER && role != Role.OWNER) {
            ensureAnotherOwner(tenantId, userId);
        }

        RoleBinding binding = identities.bind(tenantId, userId, role);
        log.info(
                "User {} set role of {} in tenant {} to {} (was {})",
                caller.subject(),
                userId,
                tenantId,
                role.value(),
                existing.map(Role::value).orElse("none"));
        return binding;
    }

    /**
     * @throws NotFoundException the user is not a member of the tenant
     */
    public void removeMember(TokenClaims caller, UUID tenantId, UUID userId) {
        Role callerRole = authorization.requireInTenant(caller, tenantId, Role.ADMIN);
        Role existing =
                identities
                        .findBinding(tenantId, userId)
                        .orElseThrow(() -> NotFoundException.binding(tenantId, userId));
        if (existing == Role.OWNER) {
            if (callerRole != Role.OWNER) {
                throw new ForbiddenException("Only an owner can remove an owner");
            }
            ensureAnotherOwner(tenantId, userId);
        }
        identities.unbind(tenantId, userId);
        log.info("User {} removed {} from tenant {}", caller.subject(), userId, tenantId);
    }

    public Tenant getTenant(TokenClaims caller, UUID tenantId) {
        authorization.requireInTenant(caller, tenantId, Role.MEMBER);
        return identities.findTenant(tenantId).orElseThrow(() -> NotFoundException.tenant(tenantId));
    }

    public List<RoleBinding> listMembers(TokenClaims caller, UUID tenantId) {
        authorization.requireInTenant(caller, tenantId, Role.MEMBER);
        return identities.listBindings(tenantId);
    }

    public Tenant renameTenant(TokenClaims caller, UUID tenantId, String name) {
        authorization.requireInTenant(caller, tenantId, Role.ADMIN);
        Tenant renamed = identities.renameTenant(tenantId, TenantProvisioner.validateName(name));
        log.info("User {} renamed tenant {}", caller.subject(), tenantId);
        return renamed;
    }

    /** Deletes the tenant and all of its bindings. Users are kept. */
    public void deleteTenant(TokenClaims caller, UUID tenantId) {
        authorization.requireInTenant(caller, tenantId, Role.OWNER);
        if (!identities.deleteTenant(tenantId)) {
            throw NotFoundException.tenant(tenantId);
        }
        log.info("User {} deleted tenant {}", caller.subject(), tenantId);
    }

    private User activeCaller(TokenClaims caller) {
        UUID userId = AuthorizationEvaluator.parse(caller.subject());
        User user =
                Optional.ofNullable(userId)
                        .flatMap(identities::findUserById)
                        .orElseThrow(InvalidCredentialsException::new);
        if (!user.active()) {
            throw new InactiveUserException();
        }
        return user;
    }

    private void ensureAnotherOwner(UUID tenantId, UUID leavingOwnerId) {
        boolean anotherOwner =
                identities.listBindings(tenantId).stream()
                        .anyMatch(b -> b.role() == Role.OWNER && !b.userId().equals(leavingOwnerId));
        if (!anotherOwner) {
            throw new ForbiddenException("A tenant must keep at least one owner");
        }
    }
}
