package io.catena.server.api;

import io.catena.core.execution.ExecutionResult;
import io.catena.core.supervisor.ExecutionRequest;
import io.catena.core.supervisor.ExecutionSummary;
import io.catena.core.supervisor.ExecutionSupervisor;
import io.catena.server.validation.LogSanitizer;
import io.catena.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.ServiceUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/// REST API for triggering and supervising executions.
///
/// Executions run asynchronously on the supervisor's worker pool; at most one
/// execution per trigger id runs at a time and later ones queue in arrival order.
///
/// @see ExecutionSupervisor
@Path("/api/v1/executions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ExecutionResource {

    private static final Logger LOG = Logger.getLogger(ExecutionResource.class);

    static final long MAX_WAIT_MS = 60_000;

    private final ExecutionSupervisor supervisor;

    @Inject
    public ExecutionResource(ExecutionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    /// Triggers a new execution.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/executions
    /// Content-Type: application/json
    ///
    /// {"triggerId": "crm-webhook", "chainId": "orders", "input": {"orderId": "o-1"}}
    /// ```
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"executionId": "exec-lx2a9k-3f9c0b1e", "chainId": "orders"}
    /// ```
    @POST
    public Response trigger(@Valid @NotNull ExecutionStartRequest request) {
        String triggerId =
                request.triggerId() == null || request.triggerId().isBlank()
                        ? request.chainId()
                        : request.triggerId();

        LOG.infov(
                "Trigger request: chain={0}, trigger={1}",
                LogSanitizer.sanitize(request.chainId()), LogSanitizer.sanitize(triggerId));

        String executionId =
                supervisor.submit(
                        new ExecutionRequest(
                                triggerId, request.chainId(), request.input(), request.env()));

        return Response.accepted()
                .entity(Map.of("executionId", executionId, "chainId", request.chainId()))
                .build();
    }

    /// Lists queued and running executions, oldest first.
    @GET
    public List<ExecutionSummary> list() {
        return supervisor.list();
    }

    /// Returns the live summary of an active execution, or the result of an ended one.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"executionId": "exec-1", "chainId": "orders", "status": "running", "completedSteps": 2}
    /// ```
    @GET
    @Path("/{executionId}")
    public Object inspect(@PathParam("executionId") @ValidId String executionId) {
        Optional<ExecutionSummary> summary = supervisor.inspect(executionId);
        if (summary.isPresent()) {
            return summary.get();
        }
        return supervisor
                .result(executionId)
                .orElseThrow(() -> notFound(executionId));
    }

    /// Waits up to `waitMs` for an execution to end and returns its result.
    ///
    /// ### Request
    /// ```
    /// GET /api/v1/executions/{executionId}/result?waitMs=5000
    /// ```
    ///
    /// ### Response
    /// - 200 with the result once the execution ended
    /// - 202 with the live summary if it is still running after the wait
    /// - 404 if the id is unknown or the result aged out
    @GET
    @Path("/{executionId}/result")
    public Response result(
            @PathParam("executionId") @ValidId String executionId,
            @QueryParam("waitMs") @DefaultValue("0") long waitMs) {
        if (waitMs < 0 || waitMs > MAX_WAIT_MS) {
            throw new BadRequestException("waitMs must be between 0 and " + MAX_WAIT_MS);
        }
        try {
            ExecutionResult result =
                    supervisor
                            .awaitResult(executionId, Duration.ofMillis(waitMs))
                            .orElseThrow(() -> notFound(executionId));
            return Response.ok(result).build();
        } catch (TimeoutException e) {
            Optional<ExecutionSummary> summary = supervisor.inspect(executionId);
            if (summary.isPresent()) {
                return Response.accepted(summary.get()).build();
            }
            ExecutionResult ended =
                    supervisor.result(executionId).orElseThrow(() -> notFound(executionId));
            return Response.ok(ended).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for the result");
        }
    }

    /// Cancels a queued or running execution.
    ///
    /// A running execution stops at its next step boundary and ends `cancelled`.
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"executionId": "exec-1", "status": "cancelling"}
    /// ```
    @DELETE
    @Path("/{executionId}")
    public Response cancel(
            @PathParam("executionId") @ValidId String executionId,
            @QueryParam("reason") @DefaultValue("cancelled by operator") String reason) {
        if (!supervisor.cancel(executionId, reason)) {
            throw notFound(executionId);
        }
        LOG.infov(
                "Cancel requested: execution={0}, reason={1}",
                LogSanitizer.sanitize(executionId), LogSanitizer.sanitize(reason));
        return Response.accepted()
                .entity(Map.of("executionId", executionId, "status", "cancelling"))
                .build();
    }

    private static NotFoundException notFound(String executionId) {
        LOG.warnv("Execution not found: {0}", LogSanitizer.sanitize(executionId));
        return new NotFoundException("Execution not found: " + executionId);
    }

    /// Request body of a trigger.
    ///
    /// @param triggerId chain instance; defaults to the chain id when absent
    /// @param chainId chain to run, required
    /// @param input trigger input, may be null
    /// @param env environment overrides, may be null
    public record ExecutionStartRequest(
            @Size(max = 256, message = "triggerId must be at most 256 characters")
                    String triggerId,
            @NotBlank(message = "chainId is required") @ValidId String chainId,
            Map<String, Object> input,
            Map<String, String> env) {}
}
