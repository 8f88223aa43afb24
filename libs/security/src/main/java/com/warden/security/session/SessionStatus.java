package com.warden.security.session;

/**
 * Lifecycle state of a {@link Session}. A session never returns to {@link #ACTIVE}.
 */
public enum SessionStatus {
    ACTIVE,
    EXPIRED,
    INVALIDATED,
    /** Still usable, but the client's IP address or user agent changed since login. */
    SUSPICIOUS
}
