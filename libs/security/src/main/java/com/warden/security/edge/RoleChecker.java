package com.warden.security.edge;

import java.util.Collection;

/**
 * Role checks over a {@link SecurityContext} whose roles are already expanded through the
 * hierarchy. {@code super_admin} satisfies every role.
 * <p>
 * WHY a utility class: the edge authority and any downstream service holding a forwarded
 * context ask the same question, and the {@code super_admin} rule must answer it the same way
 * on both sides.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    public static boolean hasRole(SecurityContext context, String required) {
        return context.isSuperAdmin() || context.roles().contains(required);
    }

    public static boolean hasAnyRole(SecurityContext context, Collection<String> required) {
        for (String role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasAllRoles(SecurityContext context, Collection<String> required) {
        for (String role : required) {
            if (!hasRole(context, role)) {
                return false;
            }
        }
        return true;
    }
}
