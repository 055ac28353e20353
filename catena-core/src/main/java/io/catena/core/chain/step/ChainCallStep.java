package io.catena.core.chain.step;

import java.util.Map;

/// Step that runs another chain as a nested execution.
///
/// The nested execution's input is built from `inputMapping`: each key becomes an
/// input field whose value is read from the dotted path in the parent variables.
/// The parent blocks until the nested run finishes and stores its projected output
/// as this step's output.
public final class ChainCallStep extends Step {

    private final String targetChainId;
    private final Map<String, String> inputMapping;

    private ChainCallStep(Builder builder) {
        super(builder);
        this.targetChainId = builder.targetChainId;
        this.inputMapping =
                builder.inputMapping != null ? Map.copyOf(builder.inputMapping) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTargetChainId() {
        return targetChainId;
    }

    /// Returns the nested input mapping.
    ///
    /// Keys are nested input field names; values are dotted paths in the parent
    /// variables, or literals prefixed with `=`.
    ///
    /// @return unmodifiable mapping, never null (may be empty)
    public Map<String, String> getInputMapping() {
        return inputMapping;
    }

    @Override
    public StepType getStepType() {
        return StepType.CHAIN_CALL;
    }

    public static final class Builder extends Step.Builder<ChainCallStep, Builder> {
        private String targetChainId;
        private Map<String, String> inputMapping;

        private Builder() {}

        public Builder targetChainId(String targetChainId) {
            this.targetChainId = targetChainId;
            return this;
        }

        public Builder inputMapping(Map<String, String> inputMapping) {
            this.inputMapping = inputMapping;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ChainCallStep build() {
            return new ChainCallStep(this);
        }
    }
}
