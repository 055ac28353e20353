package io.catena.core.execution;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.Step;
import java.time.Duration;
import java.util.List;

/// Listener for chain execution lifecycle events.
///
/// All methods have default no-op implementations. Only top-level runs report to
/// listeners; nested chain runs are reported through the step that started them.
///
/// ### Callback Lifecycle
/// ```
/// onExecutionStarted(context, chain, startIndex)
///   onStepStarted(context, step)             - step is about to run
///   onStepRetrying(context, step, ...)       - an attempt failed, waiting to retry
///   onStepCompleted(context, result)         - result recorded, routing applied
///   onCheckpoint(context, nextIndex, results) - state is consistent, safe to persist
/// onExecutionCompleted(result)
/// ```
///
/// @implNote Callbacks run on the worker thread executing the chain. Implementations
/// must return quickly; anything slow belongs behind a queue.
///
/// @see ChainRunner
public interface ExecutionListener {

    /// Called once when a run starts or resumes.
    ///
    /// @param context execution context, not null
    /// @param chain chain being executed, not null
    /// @param startIndex index of the first step to run, 0 unless resuming
    default void onExecutionStarted(
            ExecutionContext context, ChainDefinition chain, int startIndex) {}

    /// Called before a step's first attempt.
    default void onStepStarted(ExecutionContext context, Step step) {}

    /// Called when an attempt failed and a retry is scheduled.
    ///
    /// @param attempt number of the attempt that failed, starting at 1
    /// @param delay back-off before the next attempt, not null
    /// @param error message of the failed attempt, not null
    default void onStepRetrying(
            ExecutionContext context, Step step, int attempt, Duration delay, String error) {}

    /// Called when a step result has been recorded, including skipped steps.
    default void onStepCompleted(ExecutionContext context, StepResult result) {}

    /// Called after every committed step, when context, results and next index are
    /// consistent.
    ///
    /// @param context execution context, not null
    /// @param nextIndex index of the next step to run, equal to the step count at the end
    /// @param results results recorded so far, not null
    /// @throws io.catena.core.exception.CheckpointWriteException if the position could not
    ///     be persisted; the run then fails
    default void onCheckpoint(ExecutionContext context, int nextIndex, List<StepResult> results) {}

    /// Called once with the final result.
    default void onExecutionCompleted(ExecutionResult result) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
