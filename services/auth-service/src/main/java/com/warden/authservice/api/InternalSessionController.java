package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.EdgeAuthorityFilter;
import com.warden.observability.RequestContext;
import com.warden.security.session.Session;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionStatus;
import java.util.Optional;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets a front end check a session against the client it currently sees. A changed address or
 * user agent is recorded on the session; too many changes end it.
 */
@RestController
public class InternalSessionController {

    private final SessionManager sessions;

    public InternalSessionController(SessionManager sessions) {
        this.sessions = sessions;
    }

    @PostMapping("/internal/v1/sessions/{sessionId}/validate")
    public ValidationResult validate(
            @RequestAttribute(EdgeAuthorityFilter.REQUEST_CONTEXT_ATTRIBUTE) RequestContext context,
            @PathVariable String sessionId,
            @RequestBody ClientInfo client) {
        boolean valid = sessions.validateSessionSecurity(context, sessionId, client.ipAddress(), client.userAgent());
        Optional<Session> session = sessions.getSession(context, sessionId);
        return new ValidationResult(valid,
                session.map(Session::status).orElse(null),
                session.map(Session::warningCount).orElse(0));
    }

    public record ClientInfo(String ipAddress, String userAgent) {
    }

    public record ValidationResult(boolean valid, SessionStatus status, int warnings) {
    }
}
