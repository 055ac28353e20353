package io.catena.core.routing;

/// Predicate over accumulated execution variables.
///
/// A condition is either a single field comparison or a logic group combining
/// nested conditions with `AND` / `OR`. Conditions are immutable data; evaluation
/// lives in {@link ConditionEvaluator}.
///
/// ### Permitted Implementations
/// - {@link FieldCondition} - compares the value at a dotted path against an operand
/// - {@link LogicGroup} - combines child conditions
///
/// @see ConditionEvaluator#evaluate(Condition, java.util.Map)
public sealed interface Condition permits FieldCondition, LogicGroup {}
