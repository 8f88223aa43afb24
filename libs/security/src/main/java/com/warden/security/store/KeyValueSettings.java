package com.warden.security.store;

import java.time.Duration;

/**
 * Connection settings for the networked key-value store.
 *
 * @param host              server host
 * @param port              server port
 * @param password          nullable
 * @param database          logical database index
 * @param ssl               whether to use TLS
 * @param connectTimeout    bound on establishing a connection
 * @param socketTimeout     bound on each command round trip
 */
public record KeyValueSettings(
        String host,
        int port,
        String password,
        int database,
        boolean ssl,
        Duration connectTimeout,
        Duration socketTimeout
) {

    public KeyValueSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        if (password != null && password.isEmpty()) {
            password = null;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(2);
        }
        if (socketTimeout == null) {
            socketTimeout = Duration.ofSeconds(1);
        }
    }

    public static KeyValueSettings local() {
        return new KeyValueSettings("localhost", 6379, null, 0, false, null, null);
    }

    @Override
    public String toString() {
        return "KeyValueSettings[host=%s, port=%d, database=%d, ssl=%s]".formatted(host, port, database, ssl);
    }
}
