package io.catena.core.routing;

import io.catena.core.exception.ValidationException;

/// Control-flow change requested by a matching {@link RoutingRule}.
public enum RoutingAction {
    /// Continue at a later step of the same chain.
    SKIP_TO_STEP("skip_to_step"),
    /// Run another chain as a nested execution, then continue.
    JUMP_TO_CHAIN("jump_to_chain"),
    /// End the execution successfully.
    STOP_CHAIN("stop_chain");

    private final String wireName;

    RoutingAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RoutingAction fromWireName(String name) {
        for (RoutingAction action : values()) {
            if (action.wireName.equals(name)) {
                return action;
            }
        }
        throw new ValidationException("Unknown routing action: " + name);
    }
}
