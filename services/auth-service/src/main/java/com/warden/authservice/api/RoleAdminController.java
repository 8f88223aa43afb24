package com.warden.authservice.api;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.rbac.Permission;
import com.warden.security.rbac.RbacEngine;
import com.warden.security.rbac.Role;
import com.warden.security.rbac.RoleConfig;
import com.warden.security.rbac.RoleNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Role administration. The edge restricts {@code /api/v1/admin/**} to the admin tier.
 *
 * <p>Requests the engine refuses as a configuration problem (a taken name, a system role) are
 * reported to the caller as invalid requests.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class RoleAdminController {

    private final RbacEngine rbac;

    public RoleAdminController(RbacEngine rbac) {
        this.rbac = rbac;
    }

    @GetMapping("/roles")
    public List<RoleView> listRoles() {
        return rbac.listRoles().stream().map(RoleView::of).toList();
    }

    @GetMapping("/roles/{roleName}")
    public RoleView getRole(@PathVariable String roleName) {
        return rbac.getRole(roleName)
                .map(RoleView::of)
                .orElseThrow(() -> new RoleNotFoundException(roleName));
    }

    @PostMapping("/roles")
    @ResponseStatus(HttpStatus.CREATED)
    public RoleView addRole(@Valid @RequestBody RoleRequest request) {
        Role role = request.toRole();
        run(() -> rbac.addRole(role));
        return RoleView.of(rbac.getRole(role.name()).orElseThrow());
    }

    @PutMapping("/roles/{roleName}")
    public RoleView updateRole(@PathVariable String roleName, @Valid @RequestBody RoleRequest request) {
        Role role = request.toRole();
        if (!role.name().equals(Role.of(roleName).name())) {
            throw AuthException.invalidRequest("Role name in the body does not match the path");
        }
        run(() -> rbac.updateRole(role));
        return RoleView.of(rbac.getRole(role.name()).orElseThrow());
    }

    @DeleteMapping("/roles/{roleName}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeRole(@PathVariable String roleName) {
        run(() -> rbac.removeRole(roleName));
    }

    @GetMapping("/roles/export")
    public RoleConfig exportRoles() {
        return rbac.exportRoles();
    }

    /** Replaces every custom role and assignment. */
    @PutMapping("/roles/import")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void importRoles(@RequestBody RoleConfig config) {
        run(() -> rbac.importRoles(config));
    }

    @GetMapping("/users/{userId}/roles")
    public UserRolesView userRoles(@PathVariable String userId) {
        return new UserRolesView(userId,
                rbac.getUserRoles(userId, false),
                rbac.getUserRoles(userId, true),
                rbac.getEffectivePermissions(userId).stream().map(Permission::toString).sorted().toList());
    }

    @PutMapping("/users/{userId}/roles/{roleName}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void assignRole(@PathVariable String userId, @PathVariable String roleName) {
        run(() -> rbac.assignUserRole(userId, roleName));
    }

    @DeleteMapping("/users/{userId}/roles/{roleName}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeUserRole(@PathVariable String userId, @PathVariable String roleName) {
        boolean removed = call(() -> rbac.removeUserRole(userId, roleName));
        if (!removed) {
            throw AuthException.invalidRequest("User '%s' does not hold role '%s'".formatted(userId, roleName));
        }
    }

    private static void run(Runnable action) {
        call(() -> {
            action.run();
            return null;
        });
    }

    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (RoleNotFoundException e) {
            throw e;
        } catch (AuthException e) {
            if (e.kind() == AuthErrorKind.CONFIGURATION_ERROR) {
                throw AuthException.invalidRequest(e.getMessage());
            }
            throw e;
        }
    }

    /**
     * @param permissions grants in {@code action:resource} form
     */
    public record RoleRequest(
            @NotBlank String name,
            List<String> permissions,
            List<String> parentRoles,
            String tenantId) {

        Role toRole() {
            Set<Permission> grants = new LinkedHashSet<>();
            if (permissions != null) {
                for (String scope : permissions) {
                    try {
                        grants.add(Permission.parse(scope));
                    } catch (IllegalArgumentException e) {
                        throw AuthException.invalidRequest(e.getMessage());
                    }
                }
            }
            Set<String> parents = parentRoles == null ? Set.of() : new LinkedHashSet<>(parentRoles);
            return new Role(name, grants, parents, false, tenantId);
        }
    }

    public record RoleView(String name, List<String> permissions, List<String> parentRoles, boolean system,
                           String tenantId) {

        static RoleView of(Role role) {
            return new RoleView(role.name(),
                    role.permissions().stream().map(Permission::toString).sorted().toList(),
                    role.parentRoles().stream().sorted().toList(),
                    role.system(),
                    role.tenantId());
        }
    }

    public record UserRolesView(String userId, Set<String> directRoles, Set<String> effectiveRoles,
                                List<String> permissions) {
    }
}
