package com.warden.security.rbac;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One side of a permission comparison, classified once when the {@link Permission} is built.
 * <p>
 * {@code *} and {@code all} are wildcards; a value containing regex metacharacters is a pattern;
 * anything else is a literal. Comparison is symmetric: a wildcard or pattern on either side is
 * enough to satisfy it.
 */
public sealed interface MatchTerm permits MatchTerm.Literal, MatchTerm.Wildcard, MatchTerm.Regex {

    /** Characters whose presence marks a term as a regular expression. */
    Pattern REGEX_METACHARACTERS = Pattern.compile("[.*+?^${}\\[\\]|()\\\\]");

    /**
     * Normalizes (trim, lower-case) and classifies a raw action or resource.
     *
     * @throws IllegalArgumentException if the value is null or blank
     */
    static MatchTerm of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("permission term must not be null or blank");
        }
        String value = raw.strip().toLowerCase(Locale.ROOT);
        if (value.equals("*") || value.equals("all")) {
            return Wildcard.INSTANCE;
        }
        if (REGEX_METACHARACTERS.matcher(value).find()) {
            try {
                return new Regex(value, Pattern.compile(value));
            } catch (PatternSyntaxException e) {
                return new Literal(value);
            }
        }
        return new Literal(value);
    }

    /** The normalized source text. */
    String value();

    /**
     * Symmetric comparison against another term.
     */
    default boolean matches(MatchTerm other) {
        if (this instanceof Wildcard || other instanceof Wildcard) {
            return true;
        }
        if (this instanceof Regex regex && other instanceof Literal literal) {
            return regex.pattern().matcher(literal.value()).matches();
        }
        if (this instanceof Literal literal && other instanceof Regex regex) {
            return regex.pattern().matcher(literal.value()).matches();
        }
        return value().equals(other.value());
    }

    record Literal(String value) implements MatchTerm {
    }

    final class Wildcard implements MatchTerm {

        static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
        }

        @Override
        public String value() {
            return "*";
        }

        @Override
        public String toString() {
            return "Wildcard";
        }
    }

    /**
     * Pattern term. Equality is on the source text only.
     */
    record Regex(String value, Pattern pattern) implements MatchTerm {

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }
}
