package io.catena.core.invocation;

import io.catena.core.CatenaConfig;
import io.catena.core.breaker.CircuitBreaker;
import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.exception.CatenaException;
import io.catena.core.exception.CircuitOpenException;
import io.catena.core.exception.ExecutionAbortedException;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionControl;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepResult;
import io.catena.core.template.TemplateResolver;
import io.catena.core.util.Redaction;
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

/// Runs a module call step with circuit breaking, timeouts and bounded retries.
///
/// Every attempt first asks the dependency's circuit breaker for permission; a
/// rejected attempt fails with {@link CircuitOpenException} without calling anything
/// and is not reported back to the breaker. Granted attempts report success or failure.
///
/// Retryable failures are retried up to the step's retry count (engine default when
/// unset) and never beyond the execution's retry ceiling. The delay before retry `n`
/// is `retryDelay * 2^(n-1)`, capped at the configured maximum.
///
/// ### Contracts
/// - **Postcondition**: returns a `COMPLETED` or `FAILED` result, never throws for
///   failures of the call itself
/// - **Postcondition**: a permanently failing call with `r` retries available is
///   attempted exactly `r + 1` times
///
/// @implNote Thread-safe; per-run state lives in locals and the execution context.
public class RetryController {

    private static final Logger logger = Logger.getLogger(RetryController.class.getName());

    private final StepInvoker invoker;
    private final CircuitBreakerRegistry breakers;
    private final CatenaConfig config;
    private final TemplateResolver templateResolver;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryController(
            StepInvoker invoker,
            CircuitBreakerRegistry breakers,
            CatenaConfig config,
            TemplateResolver templateResolver,
            Sleeper sleeper,
            Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.breakers = Objects.requireNonNull(breakers, "breakers must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Returns the retry policy a step runs with.
    ///
    /// @param step the step, not null
    /// @return policy combining step settings with engine defaults, never null
    public RetryPolicy policyFor(ModuleCallStep step) {
        int retries =
                step.getRetryCount() != null ? step.getRetryCount() : config.getDefaultRetryCount();
        Duration delay =
                step.getRetryDelay() != null ? step.getRetryDelay() : config.getDefaultRetryDelay();
        return new RetryPolicy(retries, delay, config.getMaxRetryDelay());
    }

    /// Runs a step to a recorded result.
    ///
    /// @param step the step to run, not null
    /// @param context execution context, read for templates and charged for retries, not null
    /// @param control cancellation and deadline, not null
    /// @param listener receives retry callbacks, not null
    /// @return `COMPLETED` or `FAILED` result, never null
    /// @throws ExecutionAbortedException if the execution is cancelled or times out
    public StepResult runStep(
            ModuleCallStep step,
            ExecutionContext context,
            ExecutionControl control,
            ExecutionListener listener) {
        RetryPolicy policy = policyFor(step);
        Duration timeout =
                step.getTimeout() != null ? step.getTimeout() : config.getDefaultStepTimeout();
        Map<String, Object> params = resolveParams(step.getParams(), context.scope());

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(
                    "Step " + step.getId() + " -> " + step.getTarget() + "." + step.getOperation()
                            + " params=" + Redaction.redact(params));
        }

        Instant startedAt = clock.instant();
        List<Long> delays = new ArrayList<>();
        int retries = 0;

        for (int attempt = 1; ; attempt++) {
            control.checkActive();
            CatenaException failure;
            try {
                ActionRequest request =
                        new ActionRequest(
                                context.getExecutionId(),
                                step.getId(),
                                step.getTarget(),
                                step.getOperation(),
                                params,
                                timeout.toMillis(),
                                attempt);
                Object output = attempt(step, request, timeout, control);
                return StepResult.completed(
                        step.getId(), startedAt, clock.instant(), output, retries, delays);
            } catch (ExecutionAbortedException e) {
                throw e;
            } catch (CatenaException e) {
                failure = e;
            }

            if (!failure.isRetryable()
                    || retries >= policy.maxRetries()
                    || context.getRetriesUsed() >= config.getRetryCeiling()) {
                logger.warning(
                        "Step " + step.getId() + " failed after " + attempt + " attempt(s): "
                                + failure.getMessage());
                return StepResult.failed(
                        step.getId(),
                        startedAt,
                        clock.instant(),
                        failure.getMessage(),
                        failure.errorType(),
                        retries,
                        delays);
            }

            retries++;
            context.recordRetry();
            Duration delay = policy.delayBeforeRetry(retries);
            delays.add(delay.toMillis());
            logger.warning(
                    "Step "
                            + step.getId()
                            + " attempt "
                            + attempt
                            + " failed ("
                            + failure.errorType()
                            + "), retrying in "
                            + delay.toMillis()
                            + "ms");
            listener.onStepRetrying(context, step, attempt, delay, failure.getMessage());
            backOff(delay, control);
        }
    }

    private Object attempt(
            ModuleCallStep step,
            ActionRequest request,
            Duration timeout,
            ExecutionControl control) {
        CircuitBreaker breaker = breakers.forKey(step.getTarget());
        if (!breaker.tryAcquire()) {
            throw new CircuitOpenException(step.getTarget());
        }
        try {
            Object output = invoker.invoke(request, timeout, control);
            breaker.recordSuccess();
            return output;
        } catch (ExecutionAbortedException e) {
            breaker.abandon();
            throw e;
        } catch (CatenaException e) {
            breaker.recordFailure();
            throw e;
        } catch (RuntimeException e) {
            breaker.recordFailure();
            throw e;
        }
    }

    private void backOff(Duration delay, ExecutionControl control) {
        Duration remaining = control.remaining();
        Duration wait = delay.compareTo(remaining) > 0 ? remaining : delay;
        try {
            sleeper.sleep(wait, control.token());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionAbortedException(
                    ExecutionStatus.CANCELLED, "Worker interrupted during retry back-off");
        }
        control.checkActive();
    }

    private Map<String, Object> resolveParams(
            Map<String, Object> params, Map<String, Object> scope) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String template) {
                resolved.put(entry.getKey(), templateResolver.resolveValue(template, scope));
            } else {
                resolved.put(entry.getKey(), value);
            }
        }
        return resolved;
    }
}
