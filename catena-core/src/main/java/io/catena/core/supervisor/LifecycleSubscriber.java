package io.catena.core.supervisor;

/// Consumer of lifecycle events.
///
/// Called on the event bus dispatcher thread. Exceptions are logged by the bus and do
/// not affect other subscribers or the publishing execution.
@FunctionalInterface
public interface LifecycleSubscriber {

    void onEvent(LifecycleEvent event);
}
