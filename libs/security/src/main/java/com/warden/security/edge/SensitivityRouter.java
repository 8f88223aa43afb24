package com.warden.security.edge;

import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.List;

/**
 * Ordered table of route rules. The first rule whose path and method patterns match decides the
 * tier; requests no rule covers are {@link SensitivityTier#AUTHENTICATED}.
 * <p>
 * Path patterns are Ant-style: {@code ?} matches one character, {@code *} any run of characters
 * within a segment, {@code **} any number of segments including none, so {@code /internal/**}
 * also covers {@code /internal}.
 */
public final class SensitivityRouter {

    private static final PathMatcher PATH_MATCHER = new AntPathMatcher();

    private final List<RouteRule> rules;

    public SensitivityRouter(List<RouteRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public RouteRule resolve(String method, String path) {
        String normalizedPath = path == null || path.isEmpty() ? "/" : path;
        for (RouteRule rule : rules) {
            if (PATH_MATCHER.match(rule.pathPattern(), normalizedPath) && rule.matchesMethod(method)) {
                return rule;
            }
        }
        return RouteRule.of(normalizedPath, "*", SensitivityTier.AUTHENTICATED);
    }

    public List<RouteRule> rules() {
        return rules;
    }
}
