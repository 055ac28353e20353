package io.catena.core.chain.step;

import io.catena.core.routing.Condition;
import io.catena.core.routing.RoutingRule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Base class of the two step variants a chain can contain.
///
/// Carries the policy shared by both variants: timeout, retry settings,
/// failure tolerance, an optional skip condition and the routing rules evaluated
/// after the step has run. Unset policy values fall back to engine defaults at
/// execution time.
///
/// ### Variants
/// - {@link ModuleCallStep} - calls an external collaborator
/// - {@link ChainCallStep} - runs another chain as a nested execution
///
/// @implNote Subclasses are immutable after construction.
public abstract sealed class Step permits ModuleCallStep, ChainCallStep {

    /// Returns the variable name a step's output is stored under.
    public static String outputVariable(String stepId) {
        return "step_" + stepId + "_output";
    }

    private final String id;
    private final String name;
    private final Duration timeout;
    private final Integer retryCount;
    private final Duration retryDelay;
    private final boolean continueOnError;
    private final Condition condition;
    private final List<RoutingRule> routingRules;

    protected Step(Builder<?, ?> builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.timeout = builder.timeout;
        this.retryCount = builder.retryCount;
        this.retryDelay = builder.retryDelay;
        this.continueOnError = builder.continueOnError;
        this.condition = builder.condition;
        this.routingRules = List.copyOf(builder.routingRules);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /// Returns the per-attempt timeout.
    ///
    /// @return timeout, or null to use the engine default
    public Duration getTimeout() {
        return timeout;
    }

    /// Returns how many times a failed attempt is retried.
    ///
    /// @return retry count, or null to use the engine default
    public Integer getRetryCount() {
        return retryCount;
    }

    /// Returns the base delay before the first retry; later retries double it.
    ///
    /// @return base delay, or null to use the engine default
    public Duration getRetryDelay() {
        return retryDelay;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    /// Returns the predicate that must hold for the step to run.
    ///
    /// @return skip condition, or null when the step always runs
    public Condition getCondition() {
        return condition;
    }

    /// Returns the routing rules in evaluation order.
    ///
    /// @return unmodifiable list, never null (may be empty)
    public List<RoutingRule> getRoutingRules() {
        return routingRules;
    }

    /// Returns the variable this step's output is stored under.
    ///
    /// @return `step_<id>_output`, never null
    public String getOutputVariable() {
        return outputVariable(id);
    }

    public abstract StepType getStepType();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "'}";
    }

    /// Shared builder state for step variants.
    ///
    /// @param <T> built step type
    /// @param <B> concrete builder type, for chaining
    public abstract static class Builder<T extends Step, B extends Builder<T, B>> {
        private String id;
        private String name;
        private Duration timeout;
        private Integer retryCount;
        private Duration retryDelay;
        private boolean continueOnError;
        private Condition condition;
        private final List<RoutingRule> routingRules = new ArrayList<>();

        protected Builder() {}

        protected abstract B self();

        public abstract T build();

        public B id(String id) {
            this.id = id;
            return self();
        }

        public B name(String name) {
            this.name = name;
            return self();
        }

        public B timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        public B retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return self();
        }

        public B retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return self();
        }

        public B continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return self();
        }

        public B condition(Condition condition) {
            this.condition = condition;
            return self();
        }

        public B routingRule(RoutingRule rule) {
            this.routingRules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return self();
        }

        public B routingRules(List<RoutingRule> rules) {
            if (rules != null) {
                rules.forEach(this::routingRule);
            }
            return self();
        }
    }
}
