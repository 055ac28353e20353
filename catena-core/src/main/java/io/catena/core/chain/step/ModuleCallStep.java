package io.catena.core.chain.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Step that calls an external collaborator.
///
/// The `target` names the dependency and is the key its circuit breaker is
/// registered under; `operation` and `params` are passed through to the
/// {@link io.catena.core.invocation.StepActionDispatcher} unchanged.
public final class ModuleCallStep extends Step {

    private final String target;
    private final String operation;
    private final Map<String, Object> params;

    private ModuleCallStep(Builder builder) {
        super(builder);
        this.target = builder.target;
        this.operation = builder.operation;
        this.params = builder.params.isEmpty() ? Map.of() : copyOf(builder.params);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTarget() {
        return target;
    }

    public String getOperation() {
        return operation;
    }

    /// Returns the call parameters.
    ///
    /// @return unmodifiable map, never null (values may be null)
    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public StepType getStepType() {
        return StepType.MODULE_CALL;
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder extends Step.Builder<ModuleCallStep, Builder> {
        private String target;
        private String operation;
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder() {}

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder param(String key, Object value) {
            this.params.put(key, value);
            return this;
        }

        public Builder params(Map<String, ?> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ModuleCallStep build() {
            return new ModuleCallStep(this);
        }
    }
}
