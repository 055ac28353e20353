package io.catena.core.routing;

import java.io.Serializable;
import java.util.List;

/// Record of how routing was decided for one step.
///
/// @param evaluations every rule evaluated, in order, up to and including the match
/// @param matchedRuleId id of the winning rule, or null when none matched
/// @param actionTaken `skip_to_step`, `jump_to_chain`, `stop_chain`, `continue` or `end_of_chain`
public record RoutingTrace(
        List<RuleEvaluation> evaluations, String matchedRuleId, String actionTaken)
        implements Serializable {

    public static final String CONTINUE = "continue";
    public static final String END_OF_CHAIN = "end_of_chain";

    public RoutingTrace {
        evaluations = evaluations != null ? List.copyOf(evaluations) : List.of();
    }

    /// Returns whether any rule was evaluated.
    public boolean evaluated() {
        return !evaluations.isEmpty();
    }

    /// Returns whether a rule matched.
    public boolean matched() {
        return matchedRuleId != null;
    }

    /// Outcome of evaluating one rule.
    ///
    /// @param ruleId rule identifier, not null
    /// @param matched whether the rule's condition held
    public record RuleEvaluation(String ruleId, boolean matched) implements Serializable {}
}
