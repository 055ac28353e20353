package io.catena.server.execution;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.StepResult;
import io.catena.core.util.Redaction;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import org.jboss.logging.Logger;

/// Logs the progress of top-level executions to the server log.
///
/// Step parameters pass through {@link Redaction} so credentials never reach the log.
///
/// ### Log Format
/// ```
/// [exec-id] START chain=orders from=0
/// [exec-id] fetch -> http.get params={url=..., token=***REDACTED***}
/// [exec-id] fetch RETRY attempt=1 in=PT5S: connection reset
/// [exec-id] fetch completed in 120ms
/// [exec-id] END completed in 830ms
/// ```
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.catena.server.execution.LoggingExecutionListener`.
@ApplicationScoped
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger LOG = Logger.getLogger(LoggingExecutionListener.class);

    @Override
    public void onExecutionStarted(
            ExecutionContext context, ChainDefinition chain, int startIndex) {
        LOG.infov(
                "[{0}] START chain={1} from={2}",
                context.getExecutionId(), chain.getId(), startIndex);
    }

    @Override
    public void onStepStarted(ExecutionContext context, Step step) {
        if (step instanceof ModuleCallStep call) {
            LOG.debugv(
                    "[{0}] {1} -> {2}.{3} params={4}",
                    context.getExecutionId(),
                    step.getId(),
                    call.getTarget(),
                    call.getOperation(),
                    Redaction.redact(call.getParams()));
        } else {
            LOG.debugv("[{0}] {1} -> chain call", context.getExecutionId(), step.getId());
        }
    }

    @Override
    public void onStepRetrying(
            ExecutionContext context, Step step, int attempt, Duration delay, String error) {
        LOG.warnv(
                "[{0}] {1} RETRY attempt={2} in={3}: {4}",
                context.getExecutionId(), step.getId(), attempt, delay, error);
    }

    @Override
    public void onStepCompleted(ExecutionContext context, StepResult result) {
        LOG.infov(
                "[{0}] {1} {2} in {3}ms",
                context.getExecutionId(),
                result.stepId(),
                result.status().wireName(),
                result.durationMs());
    }

    @Override
    public void onExecutionCompleted(ExecutionResult result) {
        if (result.isSuccess()) {
            LOG.infov(
                    "[{0}] END {1} in {2}ms",
                    result.executionId(), result.status().wireName(), result.durationMs());
        } else {
            LOG.warnv(
                    "[{0}] END {1} in {2}ms: {3}",
                    result.executionId(),
                    result.status().wireName(),
                    result.durationMs(),
                    result.error());
        }
    }
}
