package com.warden.authservice.infrastructure.scheduling;

import com.warden.security.AuthException;
import com.warden.security.apikey.ApiKeyEngine;
import com.warden.security.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired sessions and rate-limit windows that can no longer be consulted.
 *
 * <p>A run that cannot reach a backend is logged and skipped; the next run tries again.
 */
@Component
public class MaintenanceJob {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceJob.class);

    private final SessionManager sessions;
    private final ApiKeyEngine apiKeys;

    public MaintenanceJob(SessionManager sessions, ApiKeyEngine apiKeys) {
        this.sessions = sessions;
        this.apiKeys = apiKeys;
    }

    @Scheduled(
            fixedDelayString = "${warden.auth.maintenance.interval:PT5M}",
            initialDelayString = "${warden.auth.maintenance.interval:PT5M}")
    public void run() {
        try {
            int expiredSessions = sessions.cleanupExpiredSessions();
            int staleWindows = apiKeys.purgeStaleRateLimitWindows();
            if (expiredSessions > 0 || staleWindows > 0) {
                log.info("Maintenance removed {} expired sessions and {} stale rate-limit windows",
                        expiredSessions, staleWindows);
            } else {
                log.debug("Maintenance found nothing to remove");
            }
        } catch (AuthException e) {
            log.warn("Maintenance run skipped: {} ({})", e.code(), e.getMessage());
        }
    }
}
