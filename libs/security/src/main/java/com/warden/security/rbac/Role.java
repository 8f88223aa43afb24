package com.warden.security.rbac;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named bundle of permissions that may inherit from parent roles.
 *
 * @param name        unique, lower-cased role name
 * @param permissions grants held directly by this role
 * @param parentRoles names of roles whose grants this role inherits
 * @param system      engine-seeded role that callers cannot change or delete
 * @param tenantId    owning tenant, or null for platform-wide roles
 */
public record Role(
        String name,
        Set<Permission> permissions,
        Set<String> parentRoles,
        boolean system,
        String tenantId
) {

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        name = normalize(name);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        parentRoles = parentRoles == null ? Set.of() : parentRoles.stream()
                .map(Role::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Creates a platform-wide, non-system role without parents.
     */
    public static Role of(String name, Permission... permissions) {
        return new Role(name, new LinkedHashSet<>(Arrays.asList(permissions)), Set.of(), false, null);
    }

    public Role withParents(String... parents) {
        return new Role(name, permissions, Set.of(parents), system, tenantId);
    }

    public Role withPermissions(Set<Permission> newPermissions) {
        return new Role(name, newPermissions, parentRoles, system, tenantId);
    }

    public Role withTenant(String newTenantId) {
        return new Role(name, permissions, parentRoles, system, newTenantId);
    }

    Role asSystem() {
        return new Role(name, permissions, parentRoles, true, tenantId);
    }

    Role withoutParent(String parent) {
        Set<String> remaining = new LinkedHashSet<>(parentRoles);
        remaining.remove(parent);
        return new Role(name, permissions, remaining, system, tenantId);
    }

    static String normalize(String roleName) {
        if (roleName == null) {
            throw new IllegalArgumentException("role name must not be null");
        }
        return roleName.strip().toLowerCase(Locale.ROOT);
    }
}
