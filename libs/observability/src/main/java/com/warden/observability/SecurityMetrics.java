package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Micrometer meters for the authorization path.
 * <p>
 * Every meter carries a {@code service} tag. Meter names:
 * <ul>
 *   <li>{@code warden.authorization.decisions{tier,outcome}}: allow/deny counts per tier</li>
 *   <li>{@code warden.authorization.duration{tier}}: end-to-end decision latency</li>
 *   <li>{@code warden.security.events{type}}: emitted security events</li>
 *   <li>{@code warden.rbac.cache{result}}: permission cache hits and misses</li>
 * </ul>
 */
public final class SecurityMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String DECISIONS = "warden.authorization.decisions";
    public static final String DURATION = "warden.authorization.duration";
    public static final String EVENTS = "warden.security.events";
    public static final String RBAC_CACHE = "warden.rbac.cache";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public void recordDecision(String tier, boolean allowed) {
        counter(DECISIONS, "Authorization decisions by tier and outcome",
                "tier", tier, "outcome", allowed ? "allow" : "deny").increment();
    }

    /**
     * Times an authorization decision. Exceptions propagate unchanged after the sample is
     * recorded.
     */
    public <T> T timeDecision(String tier, Supplier<T> decision) {
        Timer timer = Timer.builder(DURATION)
                .description("Authorization decision latency")
                .tags(baseTags("tier", tier))
                .register(registry);
        return timer.record(decision);
    }

    public void recordEvent(SecurityEventType type) {
        counter(EVENTS, "Security events emitted by the authorization core",
                "type", type.tagValue()).increment();
    }

    public void recordCacheLookup(boolean hit) {
        counter(RBAC_CACHE, "Permission cache lookups", "result", hit ? "hit" : "miss").increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
