package com.aegis.security;

/**
 * Thrown when a request names a tenant other than the one its access token was issued for.
 */
public class TenantMismatchException extends RuntimeException {

    private final String tokenTenantId;
    private final String requestedTenantId;

    public TenantMismatchException(String tokenTenantId, String requestedTenantId) {
        super("Tenant mismatch: token tenant '%s' cannot act on tenant '%s'"
                .formatted(tokenTenantId, requestedTenantId));
        this.tokenTenantId = tokenTenantId;
        this.requestedTenantId = requestedTenantId;
    }

    /** The tenant from the validated token, or null for a tenant-agnostic token. */
    public String tokenTenantId() {
        return tokenTenantId;
    }

    public String requestedTenantId() {
        return requestedTenantId;
    }
}
