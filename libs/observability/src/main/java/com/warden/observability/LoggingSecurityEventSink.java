package com.warden.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes each {@link SecurityEvent} as one structured SLF4J line on the {@code warden.security}
 * logger and counts it in {@link SecurityMetrics}.
 * <p>
 * Denials and abuse signals log at WARN, routine lifecycle events at INFO. Attributes pass
 * through {@link SensitiveDataRedactor} first.
 */
public final class LoggingSecurityEventSink implements SecurityEventSink {

    private static final Logger log = LoggerFactory.getLogger("warden.security");

    private final SensitiveDataRedactor redactor;
    private final SecurityMetrics metrics;

    public LoggingSecurityEventSink(SensitiveDataRedactor redactor, SecurityMetrics metrics) {
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redactor = redactor;
        this.metrics = metrics;
    }

    @Override
    public void publish(SecurityEvent event) {
        Map<String, Object> attributes = redactor.redact(event.attributes());
        if (isWarning(event.type())) {
            log.warn("security_event type={} correlationId={} tenant={} subject={} attributes={}",
                    event.type().tagValue(), event.correlationId(), event.tenantId(),
                    event.subject(), attributes);
        } else {
            log.info("security_event type={} correlationId={} tenant={} subject={} attributes={}",
                    event.type().tagValue(), event.correlationId(), event.tenantId(),
                    event.subject(), attributes);
        }
        if (metrics != null) {
            metrics.recordEvent(event.type());
        }
    }

    static boolean isWarning(SecurityEventType type) {
        switch (type) {
            case TOKEN_INVALID:
            case PERMISSION_DENIED:
            case TENANT_MISMATCH:
            case SERVICE_TOKEN_REJECTED:
            case RATE_LIMIT_EXCEEDED:
            case API_KEY_REJECTED:
            case SESSION_SUSPICIOUS:
                return true;
            default:
                return false;
        }
    }
}
