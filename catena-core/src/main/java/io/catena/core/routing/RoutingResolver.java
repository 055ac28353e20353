package io.catena.core.routing;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.Step;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.StepResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Decides where an execution goes after a step has run.
///
/// Rules are evaluated in declaration order against the execution scope, which
/// already contains the step's own output when it succeeded. The first rule whose
/// condition holds wins and later rules are not evaluated. Without a match the run
/// continues with the next step, or stops after the last one.
///
/// The step result itself is exposed to rules as `step.status`, `step.error` and
/// `step.error_type`, so rules can route on failures.
///
/// @implNote Stateless and thread-safe.
public class RoutingResolver {

    public static final String STEP_KEY = "step";

    private final ConditionEvaluator evaluator;

    public RoutingResolver(ConditionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /// Resolves the next action.
    ///
    /// @param step the step that ran, not null
    /// @param result its recorded result, not null
    /// @param chain the chain being executed, not null
    /// @param context execution context including the step's output, not null
    /// @return decision with trace, never null
    public RoutingDecision resolve(
            Step step, StepResult result, ChainDefinition chain, ExecutionContext context) {
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Map<String, Object> scope = scopeWithResult(context, result);
        List<RoutingTrace.RuleEvaluation> evaluations = new ArrayList<>();

        for (RoutingRule rule : step.getRoutingRules()) {
            boolean matched = evaluator.evaluate(rule.condition(), scope);
            evaluations.add(new RoutingTrace.RuleEvaluation(rule.id(), matched));
            if (matched) {
                return new RoutingDecision(
                        toAction(rule),
                        new RoutingTrace(evaluations, rule.id(), rule.action().wireName()));
            }
        }

        boolean last = chain.indexOf(step.getId()).orElse(-1) >= chain.getSteps().size() - 1;
        if (last) {
            return new RoutingDecision(
                    new NextAction.Stop("end of chain"),
                    new RoutingTrace(evaluations, null, RoutingTrace.END_OF_CHAIN));
        }
        return new RoutingDecision(
                new NextAction.Continue(),
                new RoutingTrace(evaluations, null, RoutingTrace.CONTINUE));
    }

    private static NextAction toAction(RoutingRule rule) {
        return switch (rule.action()) {
            case SKIP_TO_STEP -> new NextAction.GotoStep(rule.target());
            case JUMP_TO_CHAIN -> new NextAction.InvokeSubChain(rule.target(), rule.inputMapping());
            case STOP_CHAIN -> new NextAction.Stop("stopped by rule " + rule.id());
        };
    }

    private static Map<String, Object> scopeWithResult(
            ExecutionContext context, StepResult result) {
        Map<String, Object> stepView = new HashMap<>();
        stepView.put("id", result.stepId());
        stepView.put("status", result.status().wireName());
        stepView.put("error", result.error());
        stepView.put("error_type", result.errorType());
        stepView.put("retry_count", result.retryCount());

        Map<String, Object> scope = new HashMap<>(context.scope());
        scope.putIfAbsent(STEP_KEY, stepView);
        return scope;
    }
}
