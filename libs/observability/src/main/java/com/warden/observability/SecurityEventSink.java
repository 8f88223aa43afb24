package com.warden.observability;

/**
 * Destination for {@link SecurityEvent}s. The core only emits; deployments decide where events
 * go (logs, audit store, SIEM forwarder).
 * <p>
 * Implementations must be thread-safe and must not throw back into the request path.
 */
@FunctionalInterface
public interface SecurityEventSink {

    /** Sink that discards every event. */
    SecurityEventSink NOOP = event -> { };

    void publish(SecurityEvent event);
}
