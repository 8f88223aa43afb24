package com.warden.security.session;

import java.time.Instant;

/**
 * A security observation recorded against a session.
 *
 * @param type       {@link #IP_MISMATCH} or {@link #USER_AGENT_MISMATCH}
 * @param occurredAt when it was observed
 * @param expected   value recorded at login
 * @param observed   value seen on the later request
 */
public record SessionWarning(String type, Instant occurredAt, String expected, String observed) {

    public static final String IP_MISMATCH = "ip_mismatch";
    public static final String USER_AGENT_MISMATCH = "user_agent_mismatch";

    public SessionWarning {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
    }
}
