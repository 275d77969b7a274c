package com.aegis.observability;

/**
 * Immutable per-request context used for log correlation.
 * <p>
 * Established by the inbound HTTP filter with only a correlation id; the tenant and user are
 * filled in once the request's access token has been validated.
 *
 * @param correlationId id echoed to the client and written on every log line (never blank)
 * @param tenantId      tenant of the validated token (null before authentication)
 * @param userId        subject of the validated token (null before authentication)
 * @param requestId     id of this individual request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for a request that has not been authenticated yet. */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId);
    }

    /** Returns a copy carrying the authenticated principal. */
    public CorrelationContext withPrincipal(String userId, String tenantId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId);
    }
}
