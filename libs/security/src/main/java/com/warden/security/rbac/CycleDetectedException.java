package com.warden.security.rbac;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;

import java.util.List;

/**
 * A role definition would make the inheritance graph cyclic. The registry is left unchanged.
 */
public class CycleDetectedException extends AuthException {

    private final List<String> path;

    public CycleDetectedException(List<String> path) {
        super(AuthErrorKind.CYCLE_DETECTED,
                "Role hierarchy cycle detected: %s".formatted(String.join(" -> ", path)));
        this.path = List.copyOf(path);
    }

    /** Role names along the offending cycle, first and last equal. */
    public List<String> path() {
        return path;
    }
}
