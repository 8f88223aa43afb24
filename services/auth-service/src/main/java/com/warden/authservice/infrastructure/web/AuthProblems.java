package com.warden.authservice.infrastructure.web;

import com.warden.security.AuthErrorKind;
import com.warden.security.AuthException;
import com.warden.security.RateLimitExceededException;
import com.warden.security.rbac.RoleNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Maps {@link AuthException}s to RFC 7807 problems. Shared by the edge filter, which fails
 * before any controller runs, and by {@link GlobalExceptionHandler}.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/rate_limit_exceeded",
 *   "title": "Too Many Requests",
 *   "status": 429,
 *   "detail": "Rate limit exceeded: 1000 requests per hour",
 *   "code": "rate_limit_exceeded",
 *   "retryable": false,
 *   "window": "hour",
 *   "limit": 1000,
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
public final class AuthProblems {

    static final String TYPE_BASE = "https://warden.dev/errors/";

    private AuthProblems() {
        // utility class
    }

    public static HttpStatus statusOf(AuthException ex) {
        if (ex instanceof RoleNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        return statusOf(ex.kind());
    }

    static HttpStatus statusOf(AuthErrorKind kind) {
        return switch (kind) {
            case NOT_AUTHENTICATED, TOKEN_EXPIRED, MALFORMED_TOKEN, INVALID_SIGNATURE, INVALID_AUDIENCE,
                    INVALID_ISSUER, INVALID_TOKEN_TYPE -> HttpStatus.UNAUTHORIZED;
            case INSUFFICIENT_SCOPE, INSUFFICIENT_ROLE, MFA_REQUIRED, TENANT_MISMATCH, UNAUTHORIZED_SERVICE ->
                    HttpStatus.FORBIDDEN;
            case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case CYCLE_DETECTED -> HttpStatus.CONFLICT;
            case BACKEND_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONFIGURATION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ProblemDetail toProblem(AuthException ex, String correlationId) {
        HttpStatus status = statusOf(ex);
        String detail = status.is5xxServerError() && ex.kind() != AuthErrorKind.BACKEND_UNAVAILABLE
                ? "An unexpected error occurred" : ex.getMessage();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_BASE + ex.code()));
        problem.setProperty("code", ex.code());
        problem.setProperty("retryable", ex.retryable());
        if (ex instanceof RateLimitExceededException limited) {
            problem.setProperty("window", limited.window());
            problem.setProperty("limit", limited.limit());
        }
        enrich(problem, correlationId);
        return problem;
    }

    /**
     * Headers that accompany the problem: {@code Retry-After} for rate limits and
     * {@code WWW-Authenticate} for missing or rejected credentials.
     */
    public static HttpHeaders headersFor(AuthException ex) {
        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RateLimitExceededException limited) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, limited.retryAfter().toSeconds())));
        }
        if (ex.kind().isAuthenticationFailure()) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"%s\"".formatted(ex.code()));
        }
        return headers;
    }

    static void enrich(ProblemDetail problem, String correlationId) {
        problem.setProperty("timestamp", Instant.now().toString());
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
    }
}
