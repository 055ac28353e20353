package io.catena.core.chain;

import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.exception.ValidationException;
import io.catena.core.routing.RoutingAction;
import io.catena.core.routing.RoutingRule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// Immutable definition of a chain: an ordered list of steps plus optional output
/// projection and chain-level timeout.
///
/// ### Validation
/// The builder rejects, with {@link ValidationException}:
/// - fewer than one or more than {@value #MAX_STEPS} steps
/// - step ids that are blank, repeated, or outside `[A-Za-z0-9_-]`
/// - module calls without target or operation, chain calls without target chain
/// - step timeouts outside 1 s to 1 h, retry counts outside 0 to 5, retry delays
///   outside 100 ms to 60 s, chain timeouts outside 1 s to 2 h
/// - routing rules with a missing target, a `skip_to_step` target that is unknown
///   or does not lie after the owning step, or duplicate rule ids within a step
///
/// References to other chains are checked when the chain is registered, see
/// {@link ChainRegistry#register(ChainDefinition)}.
///
/// @implNote Immutable and thread-safe after construction.
public final class ChainDefinition {

    public static final int MAX_STEPS = 100;
    public static final Duration MIN_STEP_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration MAX_STEP_TIMEOUT = Duration.ofHours(1);
    public static final int MAX_RETRY_COUNT = 5;
    public static final Duration MIN_RETRY_DELAY = Duration.ofMillis(100);
    public static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(60);
    public static final Duration MIN_CHAIN_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration MAX_CHAIN_TIMEOUT = Duration.ofHours(2);

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final String id;
    private final String name;
    private final String description;
    private final List<Step> steps;
    private final Map<String, Integer> indexById;
    private final Map<String, String> outputTemplate;
    private final Duration timeout;

    private ChainDefinition(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.outputTemplate =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputTemplate));
        this.timeout = builder.timeout;

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            index.putIfAbsent(steps.get(i).getId(), i);
        }
        this.indexById = Map.copyOf(index);

        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    private void validate() {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new ValidationException("Chain id is missing or malformed: " + id);
        }
        if (steps.isEmpty()) {
            throw new ValidationException("Chain '" + id + "' must contain at least one step");
        }
        if (steps.size() > MAX_STEPS) {
            throw new ValidationException(
                    "Chain '" + id + "' has " + steps.size() + " steps, limit is " + MAX_STEPS);
        }
        if (timeout != null) {
            requireWithin("chain timeout", id, timeout, MIN_CHAIN_TIMEOUT, MAX_CHAIN_TIMEOUT);
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (!ID_PATTERN.matcher(step.getId()).matches()) {
                throw new ValidationException(
                        "Step id '" + step.getId() + "' in chain '" + id + "' is malformed");
            }
            if (!seen.add(step.getId())) {
                throw new ValidationException(
                        "Duplicate step id '" + step.getId() + "' in chain '" + id + "'");
            }
            validateStep(step);
            validateRoutingRules(step, i);
        }
    }

    private void validateStep(Step step) {
        String where = id + "/" + step.getId();
        if (step instanceof ModuleCallStep call) {
            if (isBlank(call.getTarget()) || isBlank(call.getOperation())) {
                throw new ValidationException(
                        "Module call step '" + where + "' needs a target and an operation");
            }
        } else if (step instanceof ChainCallStep call && isBlank(call.getTargetChainId())) {
            throw new ValidationException("Chain call step '" + where + "' needs a target chain");
        }

        if (step.getTimeout() != null) {
            requireWithin(
                    "step timeout", where, step.getTimeout(), MIN_STEP_TIMEOUT, MAX_STEP_TIMEOUT);
        }
        if (step.getRetryCount() != null
                && (step.getRetryCount() < 0 || step.getRetryCount() > MAX_RETRY_COUNT)) {
            throw new ValidationException(
                    "Retry count of '"
                            + where
                            + "' must be between 0 and "
                            + MAX_RETRY_COUNT
                            + ", was "
                            + step.getRetryCount());
        }
        if (step.getRetryDelay() != null) {
            requireWithin(
                    "retry delay", where, step.getRetryDelay(), MIN_RETRY_DELAY, MAX_RETRY_DELAY);
        }
    }

    private void validateRoutingRules(Step step, int position) {
        Set<String> ruleIds = new HashSet<>();
        for (RoutingRule rule : step.getRoutingRules()) {
            String where = id + "/" + step.getId() + "/" + rule.id();
            if (!ruleIds.add(rule.id())) {
                throw new ValidationException("Duplicate routing rule id '" + where + "'");
            }
            if (rule.action() == RoutingAction.STOP_CHAIN) {
                continue;
            }
            if (isBlank(rule.target())) {
                throw new ValidationException(
                        "Routing rule '"
                                + where
                                + "' ("
                                + rule.action().wireName()
                                + ") needs a target");
            }
            if (rule.action() == RoutingAction.SKIP_TO_STEP) {
                Integer targetIndex = indexById.get(rule.target());
                if (targetIndex == null) {
                    throw new ValidationException(
                            "Routing rule '"
                                    + where
                                    + "' targets unknown step '"
                                    + rule.target()
                                    + "'");
                }
                if (targetIndex <= position) {
                    throw new ValidationException(
                            "Routing rule '"
                                    + where
                                    + "' must target a later step, '"
                                    + rule.target()
                                    + "' is not after '"
                                    + step.getId()
                                    + "'");
                }
            }
        }
    }

    private static void requireWithin(
            String what, String where, Duration value, Duration min, Duration max) {
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new ValidationException(
                    "The "
                            + what
                            + " of '"
                            + where
                            + "' must be between "
                            + min.toMillis()
                            + "ms and "
                            + max.toMillis()
                            + "ms, was "
                            + value.toMillis()
                            + "ms");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the steps in execution order.
    ///
    /// @return unmodifiable list with at least one element, never null
    public List<Step> getSteps() {
        return steps;
    }

    /// Returns the position of a step.
    ///
    /// @param stepId step identifier, not null
    /// @return zero-based index, or empty if no step carries that id
    public Optional<Integer> indexOf(String stepId) {
        return Optional.ofNullable(indexById.get(stepId));
    }

    /// Returns the template projecting final variables into the result output.
    ///
    /// @return unmodifiable map of output keys to template strings, never null (may be empty)
    public Map<String, String> getOutputTemplate() {
        return outputTemplate;
    }

    /// Returns the chain-level timeout.
    ///
    /// @return timeout, or null to use the engine default
    public Duration getTimeout() {
        return timeout;
    }

    /// Returns the ids of every chain this chain can start: chain call targets
    /// and `jump_to_chain` rule targets.
    ///
    /// @return referenced chain ids, never null (may be empty)
    public Set<String> referencedChainIds() {
        Set<String> ids = new HashSet<>();
        for (Step step : steps) {
            if (step instanceof ChainCallStep call) {
                ids.add(call.getTargetChainId());
            }
            for (RoutingRule rule : step.getRoutingRules()) {
                if (rule.action() == RoutingAction.JUMP_TO_CHAIN) {
                    ids.add(rule.target());
                }
            }
        }
        return ids;
    }

    @Override
    public String toString() {
        return "ChainDefinition{id='" + id + "', steps=" + steps.size() + "}";
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, String> outputTemplate = new LinkedHashMap<>();
        private Duration timeout;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<? extends Step> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public Builder output(String key, String template) {
            this.outputTemplate.put(key, template);
            return this;
        }

        public Builder outputTemplate(Map<String, String> outputTemplate) {
            if (outputTemplate != null) {
                this.outputTemplate.putAll(outputTemplate);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /// Builds and validates the chain.
        ///
        /// @return the chain, never null
        /// @throws ValidationException if the definition is malformed
        public ChainDefinition build() {
            return new ChainDefinition(this);
        }
    }
}
