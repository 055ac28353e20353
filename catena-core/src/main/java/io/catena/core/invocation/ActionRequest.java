package io.catena.core.invocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One call to an external collaborator on behalf of a module call step.
///
/// `executionId`, `stepId` and `attempt` let collaborators deduplicate side effects
/// when a step is retried or resumed.
///
/// @param executionId execution making the call, not null
/// @param stepId step making the call, not null
/// @param target dependency to call, not null
/// @param operation operation to perform on the target, not null
/// @param params call parameters with templates already resolved, not null
/// @param timeoutMs time the engine waits for the response
/// @param attempt attempt number, starting at 1
public record ActionRequest(
        String executionId,
        String stepId,
        String target,
        String operation,
        Map<String, Object> params,
        long timeoutMs,
        int attempt) {

    public ActionRequest {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        params =
                params != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                        : Map.of();
    }
}
