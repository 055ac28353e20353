package io.catena.core.routing;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Evaluates {@link Condition} trees against execution variables.
///
/// Pure and deterministic: no I/O and no exceptions for missing data.
///
/// ### Semantics
/// - A missing field (or one holding `null`) fails every operator except
///   `exists` / `not_exists`; `not_exists` holds for it.
/// - `equals` compares numbers by value (`1` equals `1.0`, also against numeric
///   strings); other strings compared with a number or boolean compare by string form.
/// - `contains` checks substrings of strings, elements of collections and keys of maps.
/// - Ordering operators compare numerically when both sides are numeric (numbers
///   or numeric strings), lexicographically when both are plain strings, and fail
///   otherwise.
/// - `AND` stops at the first false child, `OR` at the first true one. An empty
///   `AND` holds; an empty `OR` does not.
///
/// @implNote Stateless and thread-safe. One instance is shared by every execution.
public class ConditionEvaluator {

    /// Evaluates a condition.
    ///
    /// @param condition condition to evaluate, not null
    /// @param variables accumulated variables, not null
    /// @return whether the condition holds
    public boolean evaluate(Condition condition, Map<String, ?> variables) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(variables, "variables must not be null");

        if (condition instanceof LogicGroup group) {
            return evaluateGroup(group, variables);
        }
        return evaluateField((FieldCondition) condition, variables);
    }

    private boolean evaluateGroup(LogicGroup group, Map<String, ?> variables) {
        if (group.logic() == LogicOperator.AND) {
            for (Condition child : group.conditions()) {
                if (!evaluate(child, variables)) {
                    return false;
                }
            }
            return true;
        }
        for (Condition child : group.conditions()) {
            if (evaluate(child, variables)) {
                return true;
            }
        }
        return false;
    }

    private boolean evaluateField(FieldCondition condition, Map<String, ?> variables) {
        Optional<Object> found = FieldPaths.resolve(variables, condition.field());
        ConditionOperator operator = condition.operator();

        if (found.isEmpty()) {
            return operator == ConditionOperator.NOT_EXISTS;
        }

        Object actual = found.get();
        Object expected = condition.value();
        return switch (operator) {
            case EXISTS -> true;
            case NOT_EXISTS -> false;
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case GREATER_OR_EQUAL -> compare(actual, expected).map(c -> c >= 0).orElse(false);
            case LESS_OR_EQUAL -> compare(actual, expected).map(c -> c <= 0).orElse(false);
        };
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number || expected instanceof Number) {
            BigDecimal left = numeric(actual);
            BigDecimal right = numeric(expected);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
        }
        if (actual instanceof String || expected instanceof String) {
            if (expected == null) {
                return false;
            }
            if (isScalar(actual) && isScalar(expected)) {
                return String.valueOf(actual).equals(String.valueOf(expected));
            }
        }
        return Objects.equals(actual, expected);
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof String text) {
            return expected != null && text.contains(String.valueOf(expected));
        }
        if (actual instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && valuesEqual(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual instanceof Map<?, ?> map) {
            return expected != null && map.containsKey(String.valueOf(expected));
        }
        return false;
    }

    /// Orders two operands, or returns empty when they have no common ordering.
    private static Optional<Integer> compare(Object actual, Object expected) {
        BigDecimal left = numeric(actual);
        BigDecimal right = numeric(expected);
        if (left != null && right != null) {
            return Optional.of(left.compareTo(right));
        }
        if (actual instanceof String a && expected instanceof String b) {
            return Optional.of(a.compareTo(b));
        }
        return Optional.empty();
    }

    private static BigDecimal numeric(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
