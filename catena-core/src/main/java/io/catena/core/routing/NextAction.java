package io.catena.core.routing;

import java.util.Map;
import java.util.Objects;

/// Decision taken by the {@link RoutingResolver} once a step has run.
public sealed interface NextAction
        permits NextAction.Continue,
                NextAction.GotoStep,
                NextAction.InvokeSubChain,
                NextAction.Stop {

    /// Proceed with the step at the next index.
    record Continue() implements NextAction {}

    /// Proceed with the named step, recording every step in between as skipped.
    ///
    /// @param stepId id of a later step in the same chain, not null
    record GotoStep(String stepId) implements NextAction {
        public GotoStep {
            Objects.requireNonNull(stepId, "stepId must not be null");
        }
    }

    /// Run another chain as a nested execution, then proceed with the next index.
    ///
    /// @param chainId chain to invoke, not null
    /// @param inputMapping nested input keys mapped to dotted paths in the parent variables
    record InvokeSubChain(String chainId, Map<String, String> inputMapping)
            implements NextAction {
        public InvokeSubChain {
            Objects.requireNonNull(chainId, "chainId must not be null");
            inputMapping = inputMapping != null ? Map.copyOf(inputMapping) : Map.of();
        }
    }

    /// End the execution.
    ///
    /// @param reason why routing ended the run, not null
    record Stop(String reason) implements NextAction {
        public Stop {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
