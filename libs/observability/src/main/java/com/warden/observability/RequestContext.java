package com.warden.observability;

import java.util.UUID;

/**
 * Immutable identity of a single inbound request, passed explicitly to every entry point of the
 * security core.
 * <p>
 * The context starts out anonymous (correlation and request IDs only) and is enriched with the
 * caller's tenant and user once a credential has been verified. Enrichment returns a new instance,
 * so a context can be handed to other threads without copying.
 *
 * @param correlationId unique ID for the business flow, propagated across services
 * @param requestId     unique ID for this specific request
 * @param tenantId      tenant of the authenticated caller (nullable until authenticated)
 * @param userId        authenticated subject (nullable until authenticated)
 */
public record RequestContext(
        String correlationId,
        String requestId,
        String tenantId,
        String userId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
    }

    /**
     * Creates an anonymous context for the given correlation ID.
     */
    public static RequestContext of(String correlationId) {
        return new RequestContext(correlationId, null, null, null);
    }

    /**
     * Creates an anonymous context with a freshly generated correlation ID.
     */
    public static RequestContext generate() {
        return of(UUID.randomUUID().toString());
    }

    /**
     * Returns a copy of this context bound to an authenticated subject.
     *
     * @param userId   the verified subject
     * @param tenantId the subject's tenant (nullable for platform-level principals)
     */
    public RequestContext withPrincipal(String userId, String tenantId) {
        return new RequestContext(correlationId, requestId, tenantId, userId);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }
}
