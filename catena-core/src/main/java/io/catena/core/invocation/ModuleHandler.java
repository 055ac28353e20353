package io.catena.core.invocation;

/// Collaborator serving every module call step addressed to one target.
///
/// ### Example Implementation
/// {@snippet :
/// public class GithubHandler implements ModuleHandler {
///     @Override
///     public String getTarget() {
///         return "github";
///     }
///
///     @Override
///     public ActionResponse handle(ActionRequest request) {
///         if (!"create_branch".equals(request.operation())) {
///             return ActionResponse.failure("Unsupported operation: " + request.operation());
///         }
///         // ... call the API
///         return ActionResponse.success(Map.of("branch", request.params().get("name")));
///     }
/// }
/// }
///
/// @see HandlerRegistryDispatcher#register(ModuleHandler)
public interface ModuleHandler {

    /// Returns the target this handler serves; also the circuit breaker key.
    ///
    /// @return target name, not null or blank
    String getTarget();

    /// Serves one call.
    ///
    /// @param request call description, not null
    /// @return response, never null
    ActionResponse handle(ActionRequest request);
}
