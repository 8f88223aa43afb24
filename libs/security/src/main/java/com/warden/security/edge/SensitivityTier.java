package com.warden.security.edge;

import java.util.Locale;

/**
 * Authentication level a route demands.
 */
public enum SensitivityTier {

    /** No credential is inspected. */
    PUBLIC,
    /** A verified user access token or API key. */
    AUTHENTICATED,
    /** Authenticated, plus the route's scopes, roles, permission and MFA requirement. */
    SENSITIVE,
    /** Like {@link #SENSITIVE}; the {@code admin} role is required when the route names no role. */
    ADMIN,
    /** A service token addressed to this service. */
    INTERNAL;

    /** Lower-case name used as a metric tag. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    boolean checksGrants() {
        return this == SENSITIVE || this == ADMIN;
    }
}
