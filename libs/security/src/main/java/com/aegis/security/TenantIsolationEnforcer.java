package com.aegis.security;

/**
 * Enforces that the effective tenant of a request is the tenant its access token was issued
 * for. Tenant ids supplied by the client (path segments, body fields) are only ever compared
 * against the token, never trusted on their own.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the validated claims are scoped to {@code requestedTenantId}.
     *
     * @param claims            validated access-token claims
     * @param requestedTenantId tenant the request wants to act on
     * @return the tenant id, for call-chaining
     * @throws TenantMismatchException if the token is tenant-agnostic or scoped elsewhere
     */
    public static String enforce(TokenClaims claims, String requestedTenantId) {
        String tokenTenantId = claims.tenantId();
        if (tokenTenantId == null || !tokenTenantId.equals(requestedTenantId)) {
            throw new TenantMismatchException(tokenTenantId, requestedTenantId);
        }
        return tokenTenantId;
    }
}
