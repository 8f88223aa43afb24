package com.warden.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps credential material out of logs and security events.
 * <p>
 * Attribute names matching a sensitive pattern (password, token, secret, authorization, apiKey,
 * credential, cookie, keyHash) are replaced by {@value #REDACTED}. Key material that must stay
 * identifiable in logs is masked to its leading characters with {@link #mask(String)}.
 * Matching is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Number of leading characters kept by {@link #mask(String)}. */
    public static final int VISIBLE_PREFIX_LENGTH = 8;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "cookie", "keyhash"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive attribute values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            result.put(key, isSensitive(key) ? REDACTED : entry.getValue());
        }
        return result;
    }

    /**
     * Checks whether an attribute name contains a sensitive pattern.
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Masks a credential to its first {@value #VISIBLE_PREFIX_LENGTH} characters followed by
     * {@code "..."}. Values no longer than the visible prefix are fully redacted.
     *
     * @param credential raw key or token (may be null)
     * @return a log-safe representation
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= VISIBLE_PREFIX_LENGTH) {
            return REDACTED;
        }
        return credential.substring(0, VISIBLE_PREFIX_LENGTH) + "...";
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
