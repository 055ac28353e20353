package io.catena.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin for `RoutingTrace`: hides the derived `evaluated()` and `matched()`.
public abstract class RoutingTraceMixin {

    @JsonIgnore
    public abstract boolean evaluated();

    @JsonIgnore
    public abstract boolean matched();
}
