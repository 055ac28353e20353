package io.catena.core.routing;

import java.util.Map;
import java.util.Objects;

/// Conditional branch evaluated after a step has run.
///
/// Rules attached to a step are evaluated in declaration order and the first
/// one whose condition holds decides the next move.
///
/// @param id rule identifier, unique within its step, not null
/// @param condition predicate over the execution variables, not null
/// @param action control-flow change applied when the condition holds, not null
/// @param target step id for `skip_to_step`, chain id for `jump_to_chain`, may be null
///     for `stop_chain`
/// @param description human-readable note, may be null
/// @param inputMapping nested-chain input keys mapped to dotted paths in the parent
///     variables, used with `jump_to_chain`, not null (may be empty)
public record RoutingRule(
        String id,
        Condition condition,
        RoutingAction action,
        String target,
        String description,
        Map<String, String> inputMapping) {

    public RoutingRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(action, "action must not be null");
        inputMapping = inputMapping != null ? Map.copyOf(inputMapping) : Map.of();
    }

    public static RoutingRule skipTo(String id, Condition condition, String stepId) {
        return new RoutingRule(id, condition, RoutingAction.SKIP_TO_STEP, stepId, null, null);
    }

    public static RoutingRule jumpTo(
            String id, Condition condition, String chainId, Map<String, String> inputMapping) {
        return new RoutingRule(
                id, condition, RoutingAction.JUMP_TO_CHAIN, chainId, null, inputMapping);
    }

    public static RoutingRule stop(String id, Condition condition) {
        return new RoutingRule(id, condition, RoutingAction.STOP_CHAIN, null, null, null);
    }
}
