package com.warden.security.rbac;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;

/**
 * A role name used in an assignment, parent list or removal is not registered.
 */
public class RoleNotFoundException extends AuthException {

    private final String roleName;

    public RoleNotFoundException(String roleName) {
        super(AuthErrorKind.CONFIGURATION_ERROR, "Role '%s' does not exist".formatted(roleName));
        this.roleName = roleName;
    }

    public String roleName() {
        return roleName;
    }
}
