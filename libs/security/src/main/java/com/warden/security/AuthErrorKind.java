package com.warden.security;

/**
 * Machine-readable classification of every expected authentication/authorization failure.
 * <p>
 * Callers branch on the kind, never on the exception class or message: an expired token prompts a
 * refresh, a bad signature is treated as an attack, an unavailable backend is retried with
 * backoff. {@link #code()} is the stable identifier exposed to API clients.
 */
public enum AuthErrorKind {

    NOT_AUTHENTICATED("not_authenticated"),
    TOKEN_EXPIRED("token_expired"),
    MALFORMED_TOKEN("malformed_token"),
    INVALID_SIGNATURE("invalid_signature"),
    INVALID_AUDIENCE("invalid_audience"),
    INVALID_ISSUER("invalid_issuer"),
    INVALID_TOKEN_TYPE("invalid_token_type"),
    INSUFFICIENT_SCOPE("insufficient_scope"),
    INSUFFICIENT_ROLE("insufficient_role"),
    MFA_REQUIRED("mfa_required"),
    TENANT_MISMATCH("tenant_mismatch"),
    UNAUTHORIZED_SERVICE("unauthorized_service"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    CONFIGURATION_ERROR("configuration_error"),
    CYCLE_DETECTED("cycle_detected"),
    INVALID_REQUEST("invalid_request"),
    BACKEND_UNAVAILABLE("backend_unavailable");

    private final String code;

    AuthErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Only an unreachable session or rate-limit store is worth retrying; every other kind is
     * terminal for the request.
     */
    public boolean retryable() {
        return this == BACKEND_UNAVAILABLE;
    }

    /**
     * True for kinds that mean "the caller's identity could not be established".
     */
    public boolean isAuthenticationFailure() {
        switch (this) {
            case NOT_AUTHENTICATED:
            case TOKEN_EXPIRED:
            case MALFORMED_TOKEN:
            case INVALID_SIGNATURE:
            case INVALID_AUDIENCE:
            case INVALID_ISSUER:
            case INVALID_TOKEN_TYPE:
                return true;
            default:
                return false;
        }
    }
}
