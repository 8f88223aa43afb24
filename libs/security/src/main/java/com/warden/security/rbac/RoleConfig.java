package com.warden.security.rbac;

import java.util.List;
import java.util.Map;

/**
 * Serializable snapshot of an engine's roles and user assignments, used for backup and seeding.
 *
 * @param roles       role definitions (system roles are exported for reference and skipped on import)
 * @param assignments user ID to directly assigned role names
 */
public record RoleConfig(List<RoleDefinition> roles, Map<String, List<String>> assignments) {

    public RoleConfig {
        roles = roles == null ? List.of() : List.copyOf(roles);
        assignments = assignments == null ? Map.of() : Map.copyOf(assignments);
    }

    public record RoleDefinition(
            String name,
            List<PermissionDefinition> permissions,
            List<String> parentRoles,
            boolean system,
            String tenantId
    ) {
        public RoleDefinition {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
            parentRoles = parentRoles == null ? List.of() : List.copyOf(parentRoles);
        }
    }

    public record PermissionDefinition(String action, String resource, Map<String, Object> conditions) {
    }
}
