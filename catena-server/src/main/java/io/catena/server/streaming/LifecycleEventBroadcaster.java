package io.catena.server.streaming;

import io.catena.core.supervisor.LifecycleEvent;
import io.catena.core.supervisor.LifecycleSubscriber;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Broadcasts lifecycle events from the core event bus to SSE subscribers.
///
/// Registered on the {@link io.catena.core.supervisor.LifecycleEventBus} at startup by
/// {@link io.catena.server.config.ServerBootstrap}. Each event is converted to an
/// {@link ExecutionEvent} and pushed to the stream of all executions and, when someone
/// follows it, to the stream of its execution.
///
/// ### Memory Management
/// A per-execution stream is completed and released when:
/// - the execution's terminal event (`completed` or `failed`) is broadcast
/// - {@link #complete(String)} is called
///
/// ### Usage
/// {@snippet :
/// eventBus.subscribe(broadcaster);
/// Multi<ExecutionEvent> all = broadcaster.subscribeAll();
/// Multi<ExecutionEvent> one = broadcaster.subscribe(executionId);
/// }
///
/// @implNote Thread-safe. Events arrive on the bus dispatcher thread;
/// `BroadcastProcessor` delivers them to each subscriber in order.
///
/// @see io.catena.server.api.ExecutionEventResource for the SSE endpoints
@ApplicationScoped
public class LifecycleEventBroadcaster implements LifecycleSubscriber {

    private static final Logger LOG = Logger.getLogger(LifecycleEventBroadcaster.class);

    private final BroadcastProcessor<ExecutionEvent> all = BroadcastProcessor.create();

    /// Maps execution id to the processor of its followers.
    private final Map<String, BroadcastProcessor<ExecutionEvent>> processors =
            new ConcurrentHashMap<>();

    /// Subscribes to events of every execution.
    ///
    /// Events published before the subscription are not replayed.
    ///
    /// @return hot event stream, completing only on shutdown
    public Multi<ExecutionEvent> subscribeAll() {
        return all;
    }

    /// Subscribes to events of one execution.
    ///
    /// Events published before the subscription are not replayed.
    ///
    /// @param executionId the execution to follow, not null
    /// @return event stream completing after the execution's terminal event
    public Multi<ExecutionEvent> subscribe(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");

        BroadcastProcessor<ExecutionEvent> processor =
                processors.computeIfAbsent(
                        executionId,
                        id -> {
                            LOG.debugv("Creating broadcast processor for execution: {0}", id);
                            return BroadcastProcessor.create();
                        });

        return processor
                .onCancellation()
                .invoke(() -> LOG.debugv("Client disconnected from execution: {0}", executionId));
    }

    @Override
    public void onEvent(LifecycleEvent event) {
        ExecutionEvent sseEvent = ExecutionEvent.from(event);
        all.onNext(sseEvent);

        String executionId = sseEvent.executionId();
        BroadcastProcessor<ExecutionEvent> processor = processors.get(executionId);
        if (processor == null) {
            LOG.tracev(
                    "No followers for execution {0}, event {1} not routed",
                    executionId, sseEvent.type());
            return;
        }
        LOG.debugv("Publishing {0} to execution {1}", sseEvent.type(), executionId);
        processor.onNext(sseEvent);
        if (sseEvent.isTerminal()) {
            complete(executionId);
        }
    }

    /// Completes and releases the stream of one execution.
    ///
    /// @param executionId the execution whose followers are released, not null
    public void complete(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");

        BroadcastProcessor<ExecutionEvent> processor = processors.remove(executionId);
        if (processor != null) {
            LOG.debugv("Completing broadcast for execution: {0}", executionId);
            processor.onComplete();
        }
    }

    /// Completes every open stream. Called on shutdown.
    public void completeAll() {
        processors.keySet().forEach(this::complete);
        all.onComplete();
    }

    /// Returns the number of executions with followers.
    public int activeSubscriptionCount() {
        return processors.size();
    }

    /// Returns whether an execution has followers.
    public boolean hasSubscribers(String executionId) {
        return processors.containsKey(executionId);
    }
}
