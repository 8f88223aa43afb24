package com.warden.security.edge;

/**
 * How the caller of a request was identified.
 */
public enum PrincipalType {
    ANONYMOUS,
    USER,
    API_KEY,
    SERVICE
}
