package com.strata.observability;

/**
 * Per-request identifiers that are copied into the SLF4J MDC so every log line of a request can
 * be tied back to the caller.
 *
 * <p>The tenant and user fields start out empty and are filled in once the session token of the
 * request has been verified.
 *
 * @param correlationId id echoed to the client in {@code X-Correlation-ID}; never blank
 * @param tenantId      tenant the request is bound to (null for Root or unauthenticated calls)
 * @param userId        authenticated principal id (null before authentication)
 * @param requestPath   servlet path of the request, for log context
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestPath
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_PATH = "requestPath";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy bound to the given principal.
     */
    public CorrelationContext withPrincipal(String userId, String tenantId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestPath);
    }
}
