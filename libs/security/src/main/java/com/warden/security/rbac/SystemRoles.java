package com.warden.security.rbac;

import java.util.List;
import java.util.Set;

/**
 * The roles every {@link RbacEngine} is seeded with.
 * <p>
 * Hierarchy: {@code super_admin} stands alone with every grant; {@code admin} inherits
 * {@code user}, which inherits {@code guest}.
 */
public final class SystemRoles {

    public static final String SUPER_ADMIN = "super_admin";
    public static final String ADMIN = "admin";
    public static final String USER = "user";
    public static final String GUEST = "guest";

    public static final Set<String> NAMES = Set.of(SUPER_ADMIN, ADMIN, USER, GUEST);

    private SystemRoles() {
        // utility class
    }

    public static boolean isSystemRole(String name) {
        return name != null && NAMES.contains(Role.normalize(name));
    }

    /**
     * Seed definitions, parents before children.
     */
    static List<Role> definitions() {
        Role guest = Role.of(GUEST,
                Permission.of("read", "public"));
        Role user = Role.of(USER,
                Permission.of("read", "user"),
                Permission.of("update", "profile"),
                Permission.of("*", "own_api_key"),
                Permission.of("*", "own_session"))
                .withParents(GUEST);
        Role admin = Role.of(ADMIN,
                Permission.of("*", "user"),
                Permission.of("*", "role"),
                Permission.of("*", "api_key"),
                Permission.of("*", "session"),
                Permission.of("read", "*"))
                .withParents(USER);
        Role superAdmin = Role.of(SUPER_ADMIN,
                Permission.of("*", "*"));
        return List.of(guest.asSystem(), user.asSystem(), admin.asSystem(), superAdmin.asSystem());
    }
}
