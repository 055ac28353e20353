package io.catena.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/// Jackson mixin for enums carrying a lower snake case `wireName()`.
///
/// `@JsonValue` drives both directions: constants are written as their wire name and
/// read back from it.
public abstract class WireNameEnumMixin {

    @JsonValue
    public abstract String wireName();
}
