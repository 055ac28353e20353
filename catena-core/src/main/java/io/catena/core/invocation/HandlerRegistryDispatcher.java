package io.catena.core.invocation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Dispatcher routing each call to the {@link ModuleHandler} registered for its target.
///
/// Calls to a target without a handler fail with a descriptive error rather than
/// throwing, so they go through the normal retry and breaker path.
///
/// @implNote Thread-safe. Handlers may be registered while executions run.
public class HandlerRegistryDispatcher implements StepActionDispatcher {

    private static final Logger logger =
            Logger.getLogger(HandlerRegistryDispatcher.class.getName());

    private final Map<String, ModuleHandler> handlers = new ConcurrentHashMap<>();

    /// Registers a handler, replacing any previous handler for the same target.
    ///
    /// @param handler handler to register, not null
    public void register(ModuleHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.put(handler.getTarget(), handler);
        logger.info("Registered module handler: " + handler.getTarget());
    }

    public Optional<ModuleHandler> getHandler(String target) {
        return Optional.ofNullable(handlers.get(target));
    }

    @Override
    public ActionResponse dispatch(ActionRequest request) {
        ModuleHandler handler = handlers.get(request.target());
        if (handler == null) {
            logger.warning(
                    "No module handler for target: "
                            + request.target()
                            + ". Registered: "
                            + handlers.keySet());
            return ActionResponse.failure(
                    "No module handler registered for target: " + request.target());
        }
        ActionResponse response = handler.handle(request);
        return response != null
                ? response
                : ActionResponse.failure("Handler '" + request.target() + "' returned no response");
    }
}
