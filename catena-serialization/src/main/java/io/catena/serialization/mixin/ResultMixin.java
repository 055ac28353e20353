package io.catena.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `StepResult` and `ExecutionResult`.
///
/// Hides the derived `isSuccess()` accessor and omits null fields such as `error` on a
/// completed result.
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ResultMixin {

    @JsonIgnore
    public abstract boolean isSuccess();
}
