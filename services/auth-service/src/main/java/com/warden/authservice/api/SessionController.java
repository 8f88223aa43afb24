package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import com.warden.observability.RequestContext;
import com.warden.security.AuthException;
import com.warden.security.edge.PrincipalType;
import com.warden.security.edge.SecurityContext;
import com.warden.security.session.Session;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Self-service view of the caller's own sessions.
 *
 * <p>A session owned by someone else is reported as not found.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    static final String NOT_FOUND = "Session not found";

    private final SessionManager sessions;

    public SessionController(SessionManager sessions) {
        this.sessions = sessions;
    }

    @GetMapping
    public List<SessionView> list(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security) {
        return sessions.listUserSessions(userOf(security)).stream()
                .map(SessionView::of)
                .toList();
    }

    @GetMapping("/{sessionId}")
    public SessionView get(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String sessionId) {
        return SessionView.of(owned(security, context, sessionId));
    }

    @PostMapping("/{sessionId}/extend")
    public SessionView extend(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "60") long minutes) {
        if (minutes <= 0) {
            throw AuthException.invalidRequest("minutes must be positive");
        }
        owned(security, context, sessionId);
        return sessions.extendSession(context, sessionId, Duration.ofMinutes(minutes))
                .map(SessionView::of)
                .orElseThrow(() -> AuthException.invalidRequest(NOT_FOUND));
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void invalidate(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String sessionId) {
        owned(security, context, sessionId);
        sessions.invalidateSession(context, sessionId);
    }

    /**
     * Signs the caller out everywhere, optionally keeping the session they are using.
     */
    @DeleteMapping
    public Map<String, Integer> invalidateAll(
            @RequestAttribute(EdgeAuthorityFilter.SECURITY_CONTEXT_ATTRIBUTE) SecurityContext security,
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @RequestParam(required = false) String except) {
        int count = sessions.invalidateUserSessions(context, userOf(security), except);
        return Map.of("invalidated", count);
    }

    private Session owned(SecurityContext security, RequestContext context, String sessionId) {
        String userId = userOf(security);
        return sessions.getSession(context, sessionId)
                .filter(session -> session.userId().equals(userId))
                .orElseThrow(() -> AuthException.invalidRequest(NOT_FOUND));
    }

    static String userOf(SecurityContext security) {
        if (security.principalType() != PrincipalType.USER) {
            throw AuthException.notAuthenticated("A user token is required");
        }
        return security.subject();
    }

    public record SessionView(
            String sessionId,
            String tenantId,
            SessionStatus status,
            Instant createdAt,
            Instant lastAccessed,
            Instant expiresAt,
            String ipAddress,
            String userAgent,
            int warnings) {

        static SessionView of(Session session) {
            return new SessionView(session.sessionId(), session.tenantId(), session.status(),
                    session.createdAt(), session.lastAccessed(), session.expiresAt(), session.ipAddress(),
                    session.userAgent(), session.warningCount());
        }
    }
}
