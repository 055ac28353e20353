package io.catena.core.invocation;

import io.catena.core.exception.ExecutionAbortedException;
import io.catena.core.exception.ExternalCallException;
import io.catena.core.exception.StepTimeoutException;
import io.catena.core.execution.ExecutionControl;
import io.catena.core.execution.ExecutionStatus;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/// Performs a single attempt of a module call under a timeout.
///
/// The dispatcher runs on a separate call pool while the worker waits for whichever
/// comes first: the response, the attempt timeout, the chain deadline or cancellation.
/// A late response is discarded and its call thread interrupted.
///
/// ### Outcomes
/// - response with `success=true` → its output is returned
/// - response with `success=false`, null response, or dispatcher exception →
///   {@link ExternalCallException}
/// - attempt timeout → {@link StepTimeoutException}
/// - chain deadline or cancellation → {@link ExecutionAbortedException}
///
/// @implNote Thread-safe; holds no per-call state.
public class StepInvoker {

    private final StepActionDispatcher dispatcher;
    private final ExecutorService callExecutor;

    /// @param dispatcher collaborator boundary, not null
    /// @param callExecutor pool running dispatcher calls, not null
    public StepInvoker(StepActionDispatcher dispatcher, ExecutorService callExecutor) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
    }

    /// Performs one attempt.
    ///
    /// @param request call to perform, not null
    /// @param timeout attempt timeout, not null
    /// @param control cancellation and deadline of the execution, not null
    /// @return the response output, may be null
    public Object invoke(ActionRequest request, Duration timeout, ExecutionControl control) {
        control.checkActive();

        Duration remaining = control.remaining();
        boolean boundByDeadline = remaining.compareTo(timeout) < 0;
        Duration wait = boundByDeadline ? remaining : timeout;

        CompletableFuture<ActionResponse> response = new CompletableFuture<>();
        Future<?> task =
                callExecutor.submit(
                        () -> {
                            try {
                                response.complete(dispatcher.dispatch(request));
                            } catch (Throwable t) {
                                response.completeExceptionally(t);
                            }
                        });

        try {
            CompletableFuture.anyOf(response, control.token().asFuture())
                    .get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            if (boundByDeadline) {
                throw new ExecutionAbortedException(
                        ExecutionStatus.TIMEOUT, "Execution exceeded its chain timeout");
            }
            throw new StepTimeoutException(request.stepId(), timeout);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionAbortedException(
                    ExecutionStatus.CANCELLED, "Worker interrupted while waiting for step");
        } catch (ExecutionException e) {
            return unwrap(request, response);
        }

        if (!response.isDone()) {
            task.cancel(true);
            control.checkActive();
        }
        return unwrap(request, response);
    }

    private static Object unwrap(
            ActionRequest request, CompletableFuture<ActionResponse> response) {
        ActionResponse result;
        try {
            result = response.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExternalCallException(
                    "Call to '" + request.target() + "' failed: " + cause.getMessage(), cause);
        }

        if (result == null) {
            throw new ExternalCallException(
                    "Call to '" + request.target() + "' returned no response");
        }
        if (!result.success()) {
            String error = result.error() != null ? result.error() : "unspecified failure";
            throw new ExternalCallException("Call to '" + request.target() + "' failed: " + error);
        }
        return result.output();
    }
}
