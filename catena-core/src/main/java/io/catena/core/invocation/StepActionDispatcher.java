package io.catena.core.invocation;

/// Boundary to the collaborators that fulfil module call steps.
///
/// The engine owns timeouts, retries and circuit breaking; implementations perform a
/// single call and report what happened. Throwing is treated like returning a failure.
///
/// @implNote Implementations must be thread-safe: concurrent executions dispatch
/// through the same instance.
///
/// @see HandlerRegistryDispatcher for the handler-per-target implementation
@FunctionalInterface
public interface StepActionDispatcher {

    /// Performs one call.
    ///
    /// @param request call description, not null
    /// @return response, never null
    ActionResponse dispatch(ActionRequest request);
}
