package io.catena.server.api;

import io.catena.server.streaming.ExecutionEvent;
import io.catena.server.streaming.LifecycleEventBroadcaster;
import io.catena.server.validation.LogSanitizer;
import io.catena.server.validation.ValidId;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// SSE endpoints for streaming lifecycle events.
///
/// Events are streamed as JSON objects:
///
/// ```
/// data: {"type":"started","executionId":"exec-1","chainId":"orders",...}
///
/// data: {"type":"step-completed","executionId":"exec-1","stepId":"fetch","status":"completed",...}
///
/// data: {"type":"completed","executionId":"exec-1","status":"completed","durationMs":830,...}
/// ```
///
/// ### Event Types
/// - `started` - execution began or resumed
/// - `step-completed` - a step result was recorded, including skipped steps
/// - `completed` - execution ended `completed`
/// - `failed` - execution ended `failed`, `timeout` or `cancelled`
///
/// Delivery is best effort: the engine drops events when the bus is full.
///
/// @see LifecycleEventBroadcaster for event publishing
@Path("/api/v1/executions")
public class ExecutionEventResource {

    private static final Logger LOG = Logger.getLogger(ExecutionEventResource.class);

    private final LifecycleEventBroadcaster broadcaster;

    @Inject
    public ExecutionEventResource(LifecycleEventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    /// Streams events of every execution.
    ///
    /// @return SSE event stream
    @GET
    @Path("/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<ExecutionEvent> streamAllEvents() {
        LOG.info("SSE subscription for all executions");

        return broadcaster
                .subscribeAll()
                .onSubscription()
                .invoke(() -> LOG.debug("Client subscribed to all executions"));
    }

    /// Streams events of one execution until its terminal event.
    ///
    /// @param executionId the execution to follow
    /// @return SSE event stream
    @GET
    @Path("/{executionId}/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<ExecutionEvent> streamEvents(
            @PathParam("executionId") @ValidId String executionId) {
        String safeId = LogSanitizer.sanitize(executionId);
        LOG.infov("SSE subscription: executionId={0}", safeId);

        return broadcaster
                .subscribe(executionId)
                .onTermination()
                .invoke(
                        (t, c) -> {
                            if (t != null) {
                                LOG.warnv(t, "SSE stream error for execution: {0}", safeId);
                            } else if (c) {
                                LOG.debugv("SSE stream cancelled for execution: {0}", safeId);
                            } else {
                                LOG.debugv("SSE stream completed for execution: {0}", safeId);
                            }
                        });
    }
}
