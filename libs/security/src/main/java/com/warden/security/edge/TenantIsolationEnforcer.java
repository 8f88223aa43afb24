package com.warden.security.edge;

import com.warden.security.TenantMismatchException;

/**
 * Enforces tenant isolation by comparing a principal's tenant against the tenant a request or
 * resource belongs to. Super admins cross tenants freely.
 * <p>
 * WHY a utility class: the tenant header check at the edge and a downstream service checking a
 * resource's tenant must agree on what counts as a mismatch. A mismatch fails fast with
 * {@link TenantMismatchException}.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @param context          the authenticated security context
     * @param resourceTenantId the tenant being addressed; null means the resource is not tenant-scoped
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(SecurityContext context, String resourceTenantId) {
        if (resourceTenantId == null || context.isSuperAdmin()) {
            return;
        }
        String contextTenantId = context.tenantId();
        if (!resourceTenantId.equals(contextTenantId)) {
            throw new TenantMismatchException(contextTenantId, resourceTenantId);
        }
    }
}
