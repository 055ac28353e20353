package io.catena.core.routing;

import java.util.Objects;

/// Leaf comparison of the value found at a dotted field path.
///
/// @param field dotted path into the variables, e.g. `step_fetch_output.status`, not null
/// @param operator comparison to apply, not null
/// @param value operand to compare against, may be null for `exists` / `not_exists`
public record FieldCondition(String field, ConditionOperator operator, Object value)
        implements Condition {

    public FieldCondition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }

    public static FieldCondition of(String field, ConditionOperator operator, Object value) {
        return new FieldCondition(field, operator, value);
    }

    public static FieldCondition exists(String field) {
        return new FieldCondition(field, ConditionOperator.EXISTS, null);
    }

    public static FieldCondition notExists(String field) {
        return new FieldCondition(field, ConditionOperator.NOT_EXISTS, null);
    }
}
