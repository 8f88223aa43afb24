package com.warden.observability;

import java.util.Locale;

/**
 * Kinds of security-relevant outcomes emitted by the authorization core.
 */
public enum SecurityEventType {
    AUTHENTICATION_SUCCEEDED,
    TOKEN_INVALID,
    PERMISSION_DENIED,
    TENANT_MISMATCH,
    SERVICE_TOKEN_REJECTED,
    RATE_LIMIT_EXCEEDED,
    API_KEY_REJECTED,
    API_KEY_CREATED,
    API_KEY_ROTATED,
    API_KEY_REVOKED,
    SESSION_CREATED,
    SESSION_INVALIDATED,
    SESSION_EXPIRED,
    SESSION_SUSPICIOUS,
    ROLE_CHANGED;

    /**
     * Lower-case name used as a metric tag and log marker, e.g. {@code rate_limit_exceeded}.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
