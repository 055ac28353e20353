package io.catena.core.routing;

import java.util.Objects;

/// Next move chosen for a step together with the trace of how it was chosen.
///
/// @param next action to take, not null
/// @param trace rules evaluated and outcome, not null
public record RoutingDecision(NextAction next, RoutingTrace trace) {

    public RoutingDecision {
        Objects.requireNonNull(next, "next must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }
}
