package com.warden.authservice.infrastructure.web;

import com.warden.security.AuthException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions thrown by controllers to RFC 7807 ProblemDetail responses. Every response
 * carries a timestamp and the request's correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        HttpStatus status = AuthProblems.statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", ex.code(), ex);
        } else {
            log.warn("Request rejected: {} ({})", ex.code(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .headers(AuthProblems.headersFor(ex))
                .body(AuthProblems.toProblem(ex, correlationId()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(AuthProblems.TYPE_BASE + "invalid_request"));
        problem.setProperty("code", "invalid_request");
        problem.setProperty("retryable", false);
        AuthProblems.enrich(problem, correlationId());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(AuthProblems.TYPE_BASE + "validation"));
        problem.setProperty("code", "invalid_request");
        problem.setProperty("retryable", false);
        AuthProblems.enrich(problem, correlationId());
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(AuthProblems.TYPE_BASE + "invalid_request"));
        problem.setProperty("code", "invalid_request");
        problem.setProperty("retryable", false);
        AuthProblems.enrich(problem, correlationId());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(AuthProblems.TYPE_BASE + "internal"));
        AuthProblems.enrich(problem, correlationId());
        return problem;
    }

    /** The edge filter keeps the correlation ID in the MDC for the whole request. */
    private static String correlationId() {
        return MDC.get("correlationId");
    }
}
