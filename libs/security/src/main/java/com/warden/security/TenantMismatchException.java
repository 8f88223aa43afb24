package com.warden.security;

/**
 * Thrown when a principal of one tenant addresses a resource or request scope of another.
 * <p>
 * The client-facing message stays generic; the two tenant IDs are available to logging code.
 */
public class TenantMismatchException extends AuthException {

    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super(AuthErrorKind.TENANT_MISMATCH, "Access denied");
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public String expectedTenantId() {
        return expectedTenantId;
    }

    public String actualTenantId() {
        return actualTenantId;
    }

    /** Detail for server-side logs only. */
    public String logDetail() {
        return "context tenant '%s' cannot access tenant '%s'"
                .formatted(expectedTenantId, actualTenantId);
    }
}
