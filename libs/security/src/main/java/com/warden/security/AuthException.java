package com.warden.security;

/**
 * Base class for every expected failure raised by the security core.
 * <p>
 * Unchecked: these are outcomes of well-formed requests that the edge layer turns into typed
 * responses. The message is safe to show to API clients and never contains credential material.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
    }

    public AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
    }

    public AuthErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }

    public boolean retryable() {
        return kind.retryable();
    }

    /** Generic denial that does not reveal whether the target exists. */
    public static AuthException accessDenied(AuthErrorKind kind) {
        return new AuthException(kind, "Access denied");
    }

    public static AuthException notAuthenticated(String message) {
        return new AuthException(AuthErrorKind.NOT_AUTHENTICATED, message);
    }

    public static AuthException invalidRequest(String message) {
        return new AuthException(AuthErrorKind.INVALID_REQUEST, message);
    }
}
