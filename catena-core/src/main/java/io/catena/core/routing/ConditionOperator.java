package io.catena.core.routing;

import io.catena.core.exception.ValidationException;

/// Comparison applied by a {@link FieldCondition}.
///
/// Each constant carries the lower snake case name used in chain definitions.
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_OR_EQUAL("greater_or_equal"),
    LESS_OR_EQUAL("less_or_equal"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Returns `true` for the operators that succeed on a missing field.
    public boolean isPresenceCheck() {
        return this == EXISTS || this == NOT_EXISTS;
    }

    /// Resolves an operator from its definition name.
    ///
    /// @param name operator name such as `greater_or_equal`, not null
    /// @return matching operator, never null
    /// @throws ValidationException if no operator carries that name
    public static ConditionOperator fromWireName(String name) {
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(name)) {
                return operator;
            }
        }
        throw new ValidationException("Unknown condition operator: " + name);
    }
}
