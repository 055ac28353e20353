package io.catena.core.execution;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.Step;
import io.catena.core.exception.CheckpointWriteException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans out all execution lifecycle events to an ordered set of delegates.
///
/// Allows composing independent listeners, e.g. checkpointing and event publishing,
/// without modifying the runner. Delegates are invoked in declaration order; an
/// exception from one delegate is logged and the remaining delegates still receive
/// the event. The one exception is a {@link CheckpointWriteException} from
/// `onCheckpoint`, which is rethrown after every delegate was notified.
///
/// {@snippet :
/// ExecutionListener composite = new CompositeExecutionListener(
///     checkpointingListener,
///     lifecycleListener
/// );
/// runner.run(chain, context, token, composite);
/// }
///
/// @implNote Thread-safe if all delegates are thread-safe.
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(CompositeExecutionListener.class.getName());

    private final List<ExecutionListener> delegates;

    public CompositeExecutionListener(ExecutionListener... delegates) {
        this(List.of(delegates));
    }

    public CompositeExecutionListener(List<ExecutionListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onExecutionStarted(
            ExecutionContext context, ChainDefinition chain, int startIndex) {
        each(d -> d.onExecutionStarted(context, chain, startIndex));
    }

    @Override
    public void onStepStarted(ExecutionContext context, Step step) {
        each(d -> d.onStepStarted(context, step));
    }

    @Override
    public void onStepRetrying(
            ExecutionContext context, Step step, int attempt, Duration delay, String error) {
        each(d -> d.onStepRetrying(context, step, attempt, delay, error));
    }

    @Override
    public void onStepCompleted(ExecutionContext context, StepResult result) {
        each(d -> d.onStepCompleted(context, result));
    }

    /// Notifies every delegate, then rethrows the first checkpoint write failure.
    @Override
    public void onCheckpoint(ExecutionContext context, int nextIndex, List<StepResult> results) {
        CheckpointWriteException failure = null;
        for (ExecutionListener delegate : delegates) {
            try {
                delegate.onCheckpoint(context, nextIndex, results);
            } catch (CheckpointWriteException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Listener " + delegate.getClass().getSimpleName() + " failed",
                        e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void onExecutionCompleted(ExecutionResult result) {
        each(d -> d.onExecutionCompleted(result));
    }

    private void each(Consumer<ExecutionListener> event) {
        for (ExecutionListener delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Listener " + delegate.getClass().getSimpleName() + " failed",
                        e);
            }
        }
    }
}
