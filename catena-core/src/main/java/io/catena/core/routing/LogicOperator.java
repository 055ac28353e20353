package io.catena.core.routing;

/// Combination mode of a {@link LogicGroup}.
public enum LogicOperator {
    AND,
    OR
}
