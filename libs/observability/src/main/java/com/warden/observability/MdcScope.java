package com.warden.observability;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

/**
 * Copies a {@link RequestContext} into the SLF4J MDC for the lifetime of a try-with-resources
 * block, then restores whatever the thread had before.
 * <p>
 * The context itself is never read back from the MDC; code that needs tenant or user IDs takes
 * the {@link RequestContext} as a parameter. The MDC only feeds log output.
 *
 * <pre>
 * try (MdcScope ignored = MdcScope.open(context)) {
 *     edgeAuthority.authorize(context, request);
 * }
 * </pre>
 */
public final class MdcScope implements AutoCloseable {

    private static final String[] KEYS = {
            RequestContext.MDC_CORRELATION_ID,
            RequestContext.MDC_REQUEST_ID,
            RequestContext.MDC_TENANT_ID,
            RequestContext.MDC_USER_ID
    };

    private final Map<String, String> previous;

    private MdcScope(Map<String, String> previous) {
        this.previous = previous;
    }

    /**
     * Populates the MDC from the given context and returns a scope that undoes it on close.
     *
     * @param context the request context (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static MdcScope open(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        Map<String, String> saved = new HashMap<>();
        for (String key : KEYS) {
            saved.put(key, MDC.get(key));
        }
        put(RequestContext.MDC_CORRELATION_ID, context.correlationId());
        put(RequestContext.MDC_REQUEST_ID, context.requestId());
        put(RequestContext.MDC_TENANT_ID, context.tenantId());
        put(RequestContext.MDC_USER_ID, context.userId());
        return new MdcScope(saved);
    }

    @Override
    public void close() {
        for (String key : KEYS) {
            put(key, previous.get(key));
        }
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
