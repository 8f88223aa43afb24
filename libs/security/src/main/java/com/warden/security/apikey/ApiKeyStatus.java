package com.warden.security.apikey;

/**
 * Lifecycle state of an {@link ApiKey}. Only {@link #ACTIVE} keys authenticate.
 */
public enum ApiKeyStatus {
    ACTIVE,
    SUSPENDED,
    REVOKED,
    EXPIRED
}
