package com.warden.security;

/**
 * A networked session or rate-limit store could not be reached within its timeout.
 * <p>
 * The only retryable failure of the core.
 *
 * @see AuthErrorKind#BACKEND_UNAVAILABLE
 */
public class BackendUnavailableException extends AuthException {

    private final String backend;

    public BackendUnavailableException(String backend, Throwable cause) {
        super(AuthErrorKind.BACKEND_UNAVAILABLE,
                "Authorization backend '%s' is unavailable".formatted(backend), cause);
        this.backend = backend;
    }

    public String backend() {
        return backend;
    }
}
