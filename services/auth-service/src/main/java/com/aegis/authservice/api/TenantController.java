package com.aegis.authservice.api;

import com.aegis.authservice.api.dto.MemberResponse;
import com.aegis.authservice.api.dto.RoleAssignmentRequest;
import com.aegis.authservice.api.dto.TenantRequest;
import com.aegis.authservice.api.dto.TenantResponse;
import com.aegis.authservice.domain.service.SessionAuthority;
import com.aegis.authservice.domain.service.TenantAdminService;
import com.aegis.security.Role;
import com.aegis.security.TokenClaims;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant and membership administration.
 *
 * <p>The {@code tenantId} path segment only names the target; the caller's access token must
 * have been issued for that same tenant, and the role checks use the token's tenant.
 */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final SessionAuthority sessions;
    private final TenantAdminService admin;

    public TenantController(SessionAuthority sessions, TenantAdminService admin) {
        this.sessions = sessions;
        this.admin = admin;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody TenantRequest request) {
        TokenClaims caller = sessions.authenticate(authorization);
        return TenantResponse.from(admin.createTenant(caller, request.name()));
    }

    @GetMapping("/{tenantId}")
    public TenantResponse get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId) {
        TokenClaims caller = sessions.authenticate(authorization);
        return TenantResponse.from(admin.getTenant(caller, tenantId));
    }

    @PatchMapping("/{tenantId}")
    public TenantResponse rename(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId,
            @Valid @RequestBody TenantRequest request) {
        TokenClaims caller = sessions.authenticate(authorization);
        return TenantResponse.from(admin.renameTenant(caller, tenantId, request.name()));
    }

    @DeleteMapping("/{tenantId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId) {
        admin.deleteTenant(sessions.authenticate(authorization), tenantId);
    }

    @GetMapping("/{tenantId}/members")
    public List<MemberResponse> listMembers(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId) {
        TokenClaims caller = sessions.authenticate(authorization);
        return admin.listMembers(caller, tenantId).stream().map(MemberResponse::from).toList();
    }

    @PutMapping("/{tenantId}/members/{userId}")
    public MemberResponse assignRole(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId,
            @PathVariable UUID userId,
            @Valid @RequestBody RoleAssignmentRequest request) {
        TokenClaims caller = sessions.authenticate(authorization);
        Role role =
                Role.fromString(request.role())
                        .orElseThrow(
                                () -> new IllegalArgumentException("Unknown role: " + request.role()));
        return MemberResponse.from(admin.assignRole(caller, tenantId, userId, role));
    }

    @DeleteMapping("/{tenantId}/members/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeMember(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID tenantId,
            @PathVariable UUID userId) {
        admin.removeMember(sessions.authenticate(authorization), tenantId, userId);
    }
}
