package com.warden.security.rbac;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates permission conditions against request attributes.
 * <p>
 * A condition maps an attribute name either to a plain value (equality) or to a map of
 * operator to operand. Supported operators: {@code eq}, {@code ne}, {@code in}, {@code not_in},
 * {@code regex}, {@code gt}, {@code lt}. All conditions must hold; a missing attribute fails its
 * condition, and an unknown operator fails closed.
 */
final class ConditionEvaluator {

    private ConditionEvaluator() {
        // utility class
    }

    static boolean evaluate(Map<String, Object> conditions, Map<String, ?> attributes) {
        if (conditions.isEmpty()) {
            return true;
        }
        if (attributes == null || attributes.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            if (!attributes.containsKey(condition.getKey())) {
                return false;
            }
            Object actual = attributes.get(condition.getKey());
            if (!holds(condition.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean holds(Object expected, Object actual) {
        if (!(expected instanceof Map<?, ?> operators)) {
            return equalsLoosely(expected, actual);
        }
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            if (!apply(String.valueOf(entry.getKey()), entry.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean apply(String operator, Object operand, Object actual) {
        switch (operator) {
            case "eq":
                return equalsLoosely(operand, actual);
            case "ne":
                return !equalsLoosely(operand, actual);
            case "in":
                return operand instanceof Collection<?> values && containsLoosely(values, actual);
            case "not_in":
                return operand instanceof Collection<?> values && !containsLoosely(values, actual);
            case "regex":
                return actual != null && regexMatches(String.valueOf(operand), String.valueOf(actual));
            case "gt":
                return compare(actual, operand) > 0;
            case "lt":
                return compare(actual, operand) < 0;
            default:
                return false;
        }
    }

    private static boolean equalsLoosely(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Number a && actual instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return String.valueOf(expected).equals(String.valueOf(actual));
    }

    private static boolean containsLoosely(Collection<?> values, Object actual) {
        for (Object value : values) {
            if (equalsLoosely(value, actual)) {
                return true;
            }
        }
        return false;
    }

    private static boolean regexMatches(String regex, String value) {
        try {
            return Pattern.compile(regex).matcher(value).matches();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    /**
     * Numeric comparison; non-numeric operands compare as "not greater and not less".
     */
    private static int compare(Object actual, Object operand) {
        Double left = toDouble(actual);
        Double right = toDouble(operand);
        if (left == null || right == null) {
            return 0;
        }
        return Double.compare(left, right);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
