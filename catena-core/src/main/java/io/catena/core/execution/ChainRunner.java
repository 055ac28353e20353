package io.catena.core.execution;

import io.catena.core.CatenaConfig;
import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.exception.CatenaException;
import io.catena.core.exception.ExecutionAbortedException;
import io.catena.core.exception.MaxRecursionDepthExceededException;
import io.catena.core.invocation.RetryController;
import io.catena.core.routing.ConditionEvaluator;
import io.catena.core.routing.FieldPaths;
import io.catena.core.routing.NextAction;
import io.catena.core.routing.RoutingDecision;
import io.catena.core.routing.RoutingResolver;
import io.catena.core.template.TemplateResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives one execution through the steps of a chain.
///
/// ### Execution loop
/// For each step, starting at index 0 (or the checkpointed index when resuming):
/// 1. stop if the execution was cancelled or its chain deadline passed
/// 2. if the step's condition does not hold, record it as `SKIPPED` and move on
/// 3. run it: module calls through the {@link RetryController}, chain calls as a
///    nested run that blocks this one
/// 4. on success append the output to the variables as `step_<id>_output`
/// 5. resolve routing and record the trace on the step result
/// 6. continue, skip ahead, run a jumped-to chain or stop, then report a checkpoint
///
/// A step that fails without `continueOnError` ends the run as `FAILED` unless one of
/// its routing rules redirects it with `skip_to_step` or `jump_to_chain`.
///
/// ### Nested runs
/// Chain call steps and `jump_to_chain` rules start a nested run with its own context,
/// seeded from an input mapping resolved against the parent's scope. The nested depth
/// is checked at the top of every run; exceeding the configured limit fails the whole
/// execution with {@link MaxRecursionDepthExceededException}, as does a reference to
/// an unknown chain. Nested runs share the parent's cancellation token and are bounded
/// by both deadlines. Only the top-level run reports to the listener.
///
/// @implNote Thread-safe; one instance serves all workers. Each run is confined to
/// the calling thread.
///
/// @see RetryController
/// @see RoutingResolver
public class ChainRunner {

    private static final Logger logger = Logger.getLogger(ChainRunner.class.getName());

    private static final String LITERAL_PREFIX = "=";

    private final ChainRegistry chains;
    private final RetryController retryController;
    private final RoutingResolver routingResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final TemplateResolver templateResolver;
    private final CatenaConfig config;
    private final Clock clock;

    public ChainRunner(
            ChainRegistry chains,
            RetryController retryController,
            RoutingResolver routingResolver,
            ConditionEvaluator conditionEvaluator,
            TemplateResolver templateResolver,
            CatenaConfig config,
            Clock clock) {
        this.chains = Objects.requireNonNull(chains, "chains must not be null");
        this.retryController =
                Objects.requireNonNull(retryController, "retryController must not be null");
        this.routingResolver =
                Objects.requireNonNull(routingResolver, "routingResolver must not be null");
        this.conditionEvaluator =
                Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Runs a chain from its first step.
    ///
    /// @param chain chain to run, not null
    /// @param context fresh execution context, not null
    /// @param token cancellation token, not null
    /// @param listener lifecycle listener, not null
    /// @return terminal result, never null
    public ExecutionResult run(
            ChainDefinition chain,
            ExecutionContext context,
            CancellationToken token,
            ExecutionListener listener) {
        return execute(chain, context, 0, List.of(), token, listener);
    }

    /// Re-enters a chain at a checkpointed position.
    ///
    /// Steps before `nextIndex` are not run again; their results are carried into the
    /// final result unchanged.
    ///
    /// @param chain chain to run, not null
    /// @param context restored execution context, not null
    /// @param nextIndex index of the first step to run
    /// @param priorResults results recorded before the checkpoint, not null
    /// @param token cancellation token, not null
    /// @param listener lifecycle listener, not null
    /// @return terminal result, never null
    public ExecutionResult resume(
            ChainDefinition chain,
            ExecutionContext context,
            int nextIndex,
            List<StepResult> priorResults,
            CancellationToken token,
            ExecutionListener listener) {
        if (nextIndex < 0 || nextIndex > chain.getSteps().size()) {
            throw new IllegalArgumentException(
                    "nextIndex " + nextIndex + " outside chain '" + chain.getId() + "'");
        }
        logger.info(
                "Resuming execution " + context.getExecutionId() + " at step index " + nextIndex);
        return execute(chain, context, nextIndex, priorResults, token, listener);
    }

    private ExecutionResult execute(
            ChainDefinition chain,
            ExecutionContext context,
            int startIndex,
            List<StepResult> priorResults,
            CancellationToken token,
            ExecutionListener listener) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Instant startedAt = clock.instant();
        ExecutionControl control = ExecutionControl.start(token, timeoutOf(chain), clock);
        List<StepResult> results = new ArrayList<>(priorResults);

        logger.info(
                "Starting execution " + context.getExecutionId() + " of chain " + chain.getId());
        listener.onExecutionStarted(context, chain, startIndex);

        ExecutionResult result;
        try {
            Outcome outcome = drive(chain, context, startIndex, results, control, listener);
            result = outcome.toResult(context, results, startedAt, clock.instant());
        } catch (ExecutionAbortedException e) {
            result =
                    ended(
                            context,
                            e.getStatus(),
                            results,
                            startedAt,
                            e.getMessage(),
                            e.errorType());
        } catch (CatenaException e) {
            result =
                    ended(
                            context,
                            ExecutionStatus.FAILED,
                            results,
                            startedAt,
                            e.getMessage(),
                            e.errorType());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Execution " + context.getExecutionId() + " crashed", e);
            result =
                    ended(
                            context,
                            ExecutionStatus.FAILED,
                            results,
                            startedAt,
                            e.toString(),
                            "internal");
        }

        logger.info(
                "Execution "
                        + result.executionId()
                        + " ended "
                        + result.status().wireName()
                        + " after "
                        + result.durationMs()
                        + "ms");
        listener.onExecutionCompleted(result);
        return result;
    }

    private Outcome drive(
            ChainDefinition chain,
            ExecutionContext context,
            int startIndex,
            List<StepResult> results,
            ExecutionControl control,
            ExecutionListener listener) {
        if (context.getDepth() > config.getMaxRecursionDepth()) {
            throw new MaxRecursionDepthExceededException(
                    chain.getId(), context.getDepth(), config.getMaxRecursionDepth());
        }

        List<Step> steps = chain.getSteps();
        int index = startIndex;
        while (index < steps.size()) {
            control.checkActive();
            Step step = steps.get(index);

            if (step.getCondition() != null
                    && !conditionEvaluator.evaluate(step.getCondition(), context.scope())) {
                StepResult skipped =
                        StepResult.skipped(step.getId(), clock.instant(), "condition not met");
                commit(context, results, skipped, listener);
                index++;
                listener.onCheckpoint(context.copy(), index, List.copyOf(results));
                continue;
            }

            listener.onStepStarted(context, step);
            StepResult result = executeStep(step, context, control, listener);
            if (result.isSuccess()) {
                context.putVariable(step.getOutputVariable(), result.output());
            }

            RoutingDecision decision = routingResolver.resolve(step, result, chain, context);
            result = result.withRouting(decision.trace());
            commit(context, results, result, listener);

            NextAction next = decision.next();
            boolean redirected =
                    next instanceof NextAction.GotoStep
                            || next instanceof NextAction.InvokeSubChain;
            if (!result.isSuccess() && !step.isContinueOnError() && !redirected) {
                String error = "Step '" + step.getId() + "' failed: " + result.error();
                return Outcome.failed(error, result.errorType());
            }

            if (next instanceof NextAction.Stop) {
                index = steps.size();
            } else if (next instanceof NextAction.GotoStep gotoStep) {
                int target = chain.indexOf(gotoStep.stepId()).orElseThrow();
                String reason =
                        "routed to "
                                + gotoStep.stepId()
                                + " by rule "
                                + decision.trace().matchedRuleId();
                for (int i = index + 1; i < target; i++) {
                    StepResult skipped =
                            StepResult.skipped(steps.get(i).getId(), clock.instant(), reason);
                    commit(context, results, skipped, listener);
                }
                index = target;
            } else if (next instanceof NextAction.InvokeSubChain jump) {
                ExecutionResult nested =
                        runNested(jump.chainId(), jump.inputMapping(), context, control);
                if (!nested.isSuccess()) {
                    return Outcome.failed(
                            "Chain '"
                                    + jump.chainId()
                                    + "' jumped to from step '"
                                    + step.getId()
                                    + "' ended "
                                    + nested.status().wireName()
                                    + ": "
                                    + nested.error(),
                            nested.errorType());
                }
                context.putVariable(jumpOutputVariable(step.getId()), nested.output());
                index++;
            } else {
                index++;
            }

            listener.onCheckpoint(context.copy(), index, List.copyOf(results));
        }

        return Outcome.completed(project(chain, context));
    }

    private StepResult executeStep(
            Step step,
            ExecutionContext context,
            ExecutionControl control,
            ExecutionListener listener) {
        if (step instanceof ModuleCallStep call) {
            return retryController.runStep(call, context, control, listener);
        }

        ChainCallStep call = (ChainCallStep) step;
        Instant startedAt = clock.instant();
        ExecutionResult nested =
                runNested(call.getTargetChainId(), call.getInputMapping(), context, control);
        if (nested.isSuccess()) {
            return StepResult.completed(
                    step.getId(), startedAt, clock.instant(), nested.output(), 0, List.of());
        }
        return StepResult.failed(
                step.getId(),
                startedAt,
                clock.instant(),
                "Chain '"
                        + call.getTargetChainId()
                        + "' ended "
                        + nested.status().wireName()
                        + ": "
                        + nested.error(),
                nested.errorType() != null ? nested.errorType() : nested.status().wireName(),
                0,
                List.of());
    }

    /// Runs a nested chain to completion on the current thread.
    ///
    /// Terminal errors (unknown chain, depth exceeded) and aborts of the parent propagate;
    /// everything else is reported through the returned result.
    private ExecutionResult runNested(
            String chainId,
            Map<String, String> inputMapping,
            ExecutionContext parent,
            ExecutionControl control) {
        ChainDefinition target = chains.require(chainId);
        Map<String, Object> input = resolveInput(inputMapping, parent.scope());
        ExecutionContext child = parent.child(ExecutionIds.generate(clock), chainId, input);
        ExecutionControl childControl = control.nested(timeoutOf(target));
        List<StepResult> childResults = new ArrayList<>();
        Instant startedAt = clock.instant();

        logger.fine(
                "Execution "
                        + parent.getExecutionId()
                        + " entering chain "
                        + chainId
                        + " at depth "
                        + child.getDepth());

        try {
            Outcome outcome =
                    drive(target, child, 0, childResults, childControl, ExecutionListener.NOOP);
            return outcome.toResult(child, childResults, startedAt, clock.instant());
        } catch (ExecutionAbortedException e) {
            if (control.token().isCancelled() || control.isExpired()) {
                throw e;
            }
            return ended(
                    child, e.getStatus(), childResults, startedAt, e.getMessage(), e.errorType());
        }
    }

    private void commit(
            ExecutionContext context,
            List<StepResult> results,
            StepResult result,
            ExecutionListener listener) {
        results.add(result);
        listener.onStepCompleted(context, result);
    }

    /// Builds nested input: keys map to dotted paths in the parent scope, `{...}`
    /// templates, or `=`-prefixed literals.
    private Map<String, Object> resolveInput(
            Map<String, String> mapping, Map<String, Object> scope) {
        Map<String, Object> input = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String source = entry.getValue();
            Object value;
            if (source == null) {
                value = null;
            } else if (source.startsWith(LITERAL_PREFIX)) {
                value = source.substring(LITERAL_PREFIX.length());
            } else if (source.contains("{")) {
                value = templateResolver.resolveValue(source, scope);
            } else {
                value = FieldPaths.resolve(scope, source).orElse(null);
            }
            input.put(entry.getKey(), value);
        }
        return input;
    }

    /// Projects final variables through the chain's output template, or returns all
    /// variables when the chain has none.
    private Map<String, Object> project(ChainDefinition chain, ExecutionContext context) {
        if (chain.getOutputTemplate().isEmpty()) {
            return new LinkedHashMap<>(context.getVariables());
        }
        Map<String, Object> scope = context.scope();
        Map<String, Object> output = new LinkedHashMap<>();
        chain.getOutputTemplate()
                .forEach(
                        (key, template) ->
                                output.put(key, templateResolver.resolveValue(template, scope)));
        return output;
    }

    private Duration timeoutOf(ChainDefinition chain) {
        return chain.getTimeout() != null ? chain.getTimeout() : config.getDefaultChainTimeout();
    }

    private ExecutionResult ended(
            ExecutionContext context,
            ExecutionStatus status,
            List<StepResult> results,
            Instant startedAt,
            String error,
            String errorType) {
        return ExecutionResult.ended(
                context.getExecutionId(),
                context.getChainId(),
                status,
                results,
                startedAt,
                clock.instant(),
                error,
                errorType);
    }

    /// Returns the variable a `jump_to_chain` result is stored under.
    public static String jumpOutputVariable(String stepId) {
        return "step_" + stepId + "_jump_output";
    }

    private record Outcome(
            ExecutionStatus status, Map<String, Object> output, String error, String errorType) {

        static Outcome completed(Map<String, Object> output) {
            return new Outcome(ExecutionStatus.COMPLETED, output, null, null);
        }

        static Outcome failed(String error, String errorType) {
            return new Outcome(ExecutionStatus.FAILED, null, error, errorType);
        }

        ExecutionResult toResult(
                ExecutionContext context,
                List<StepResult> results,
                Instant startedAt,
                Instant completedAt) {
            if (status == ExecutionStatus.COMPLETED) {
                return ExecutionResult.completed(
                        context.getExecutionId(),
                        context.getChainId(),
                        results,
                        startedAt,
                        completedAt,
                        output);
            }
            return ExecutionResult.ended(
                    context.getExecutionId(),
                    context.getChainId(),
                    status,
                    results,
                    startedAt,
                    completedAt,
                    error,
                    errorType);
        }
    }
}
