package com.warden.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured record of a security decision, handed to a {@link SecurityEventSink}.
 *
 * @param type          what happened
 * @param occurredAt    when it happened
 * @param correlationId correlation ID of the triggering request (nullable for background work)
 * @param tenantId      tenant involved (nullable)
 * @param subject       user, service or key prefix involved (nullable)
 * @param attributes    event-specific details; sinks redact sensitive names before output
 */
public record SecurityEvent(
        SecurityEventType type,
        Instant occurredAt,
        String correlationId,
        String tenantId,
        String subject,
        Map<String, Object> attributes
) {

    public SecurityEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Starts an event bound to the given request.
     */
    public static Builder of(SecurityEventType type, RequestContext context) {
        Builder builder = new Builder(type);
        if (context != null) {
            builder.correlationId = context.correlationId();
            builder.tenantId = context.tenantId();
            builder.subject = context.userId();
        }
        return builder;
    }

    /**
     * Starts an event that is not tied to a request (maintenance, administration).
     */
    public static Builder of(SecurityEventType type) {
        return new Builder(type);
    }

    public static final class Builder {

        private final SecurityEventType type;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private Instant occurredAt;
        private String correlationId;
        private String tenantId;
        private String subject;

        private Builder(SecurityEventType type) {
            this.type = type;
        }

        public Builder at(Instant instant) {
            this.occurredAt = instant;
            return this;
        }

        public Builder tenant(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        /** Adds an attribute; null values are skipped. */
        public Builder with(String key, Object value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(type, occurredAt, correlationId, tenantId, subject, attributes);
        }
    }
}
