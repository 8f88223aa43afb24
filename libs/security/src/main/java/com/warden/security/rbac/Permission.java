package com.warden.security.rbac;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable grant of an action on a resource, optionally guarded by attribute conditions.
 * <p>
 * Action and resource are lower-cased and classified into {@link MatchTerm}s at construction, so
 * matching never re-inspects the raw strings. Equality and hashing use the normalized action,
 * resource and conditions.
 *
 * <pre>
 * Permission.of("read", "*").matches("read", "billing");   // true
 * Permission.parse("read:user").matches("write", "user");  // false
 * </pre>
 */
public final class Permission {

    private final MatchTerm action;
    private final MatchTerm resource;
    private final Map<String, Object> conditions;

    private Permission(MatchTerm action, MatchTerm resource, Map<String, Object> conditions) {
        this.action = action;
        this.resource = resource;
        this.conditions = conditions == null ? Map.of() : Map.copyOf(conditions);
    }

    public static Permission of(String action, String resource) {
        return new Permission(MatchTerm.of(action), MatchTerm.of(resource), Map.of());
    }

    public static Permission of(String action, String resource, Map<String, Object> conditions) {
        return new Permission(MatchTerm.of(action), MatchTerm.of(resource), conditions);
    }

    /**
     * Parses a scope string of the form {@code action:resource}.
     *
     * @throws IllegalArgumentException if the scope has no separator or an empty side
     */
    public static Permission parse(String scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        int separator = scope.indexOf(':');
        if (separator <= 0 || separator == scope.length() - 1) {
            throw new IllegalArgumentException("scope must have the form action:resource, got '%s'"
                    .formatted(scope));
        }
        return of(scope.substring(0, separator), scope.substring(separator + 1));
    }

    /**
     * Tests this grant against a requested action and resource. Conditions are not consulted.
     */
    public boolean matches(String requestedAction, String requestedResource) {
        return matches(MatchTerm.of(requestedAction), MatchTerm.of(requestedResource));
    }

    public boolean matches(MatchTerm requestedAction, MatchTerm requestedResource) {
        return action.matches(requestedAction) && resource.matches(requestedResource);
    }

    /**
     * Whether this grant applies to a request carrying the given attributes. A grant without
     * conditions always applies.
     */
    public boolean conditionsSatisfied(Map<String, ?> attributes) {
        return ConditionEvaluator.evaluate(conditions, attributes);
    }

    public boolean isConditional() {
        return !conditions.isEmpty();
    }

    public String action() {
        return action.value();
    }

    public String resource() {
        return resource.value();
    }

    public MatchTerm actionTerm() {
        return action;
    }

    public MatchTerm resourceTerm() {
        return resource;
    }

    public Map<String, Object> conditions() {
        return conditions;
    }

    /** Scope form, e.g. {@code read:user}. */
    public String toScope() {
        return action.value() + ":" + resource.value();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Permission other)) {
            return false;
        }
        return action.value().equals(other.action.value())
                && resource.value().equals(other.resource.value())
                && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action.value(), resource.value(), conditions);
    }

    @Override
    public String toString() {
        return conditions.isEmpty() ? toScope() : toScope() + conditions;
    }
}
