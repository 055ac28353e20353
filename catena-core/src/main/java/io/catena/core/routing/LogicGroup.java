package io.catena.core.routing;

import java.util.List;
import java.util.Objects;

/// Combines child conditions with a single logic operator.
///
/// An empty `AND` group holds; an empty `OR` group does not.
///
/// @param logic how children are combined, not null
/// @param conditions child conditions in evaluation order, not null (may be empty)
public record LogicGroup(LogicOperator logic, List<Condition> conditions) implements Condition {

    public LogicGroup {
        Objects.requireNonNull(logic, "logic must not be null");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static LogicGroup and(Condition... conditions) {
        return new LogicGroup(LogicOperator.AND, List.of(conditions));
    }

    public static LogicGroup or(Condition... conditions) {
        return new LogicGroup(LogicOperator.OR, List.of(conditions));
    }
}
