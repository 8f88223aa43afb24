package com.warden.security.edge;

import com.warden.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Test
    @DisplayName("hasRole checks the expanded role set")
    void hasRole() {
        var ctx = TestSecurityContextFactory.create();

        assertThat(RoleChecker.hasRole(ctx, "user")).isTrue();
        assertThat(RoleChecker.hasRole(ctx, "guest")).isTrue();
        assertThat(RoleChecker.hasRole(ctx, "admin")).isFalse();
    }

    @Test
    @DisplayName("hasAnyRole and hasAllRoles")
    void anyAndAll() {
        var ctx = TestSecurityContextFactory.createWithRoles("admin", "user");

        assertThat(RoleChecker.hasAnyRole(ctx, List.of("auditor", "admin"))).isTrue();
        assertThat(RoleChecker.hasAnyRole(ctx, List.of("auditor"))).isFalse();
        assertThat(RoleChecker.hasAllRoles(ctx, List.of("admin", "user"))).isTrue();
        assertThat(RoleChecker.hasAllRoles(ctx, List.of("admin", "auditor"))).isFalse();
        assertThat(RoleChecker.hasAllRoles(ctx, List.of())).isTrue();
    }

    @Test
    @DisplayName("super_admin satisfies every role")
    void superAdmin() {
        var ctx = TestSecurityContextFactory.createWithRoles("super_admin");

        assertThat(RoleChecker.hasAllRoles(ctx, List.of("admin", "auditor"))).isTrue();
    }
}
