package io.catena.server.api;

import io.catena.core.checkpoint.Checkpoint;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.exception.CheckpointIntegrityException;
import io.catena.server.validation.LogSanitizer;
import io.catena.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Admin API for stored checkpoints.
///
/// Checkpoints are listed by metadata only; context and step outputs stay encrypted
/// at rest and are never returned.
@Path("/api/v1/checkpoints")
@Produces(MediaType.APPLICATION_JSON)
public class CheckpointResource {

    private static final Logger LOG = Logger.getLogger(CheckpointResource.class);

    static final String STATUS_CORRUPT = "corrupt";

    private final CheckpointManager checkpoints;

    @Inject
    public CheckpointResource(CheckpointManager checkpoints) {
        this.checkpoints = checkpoints;
    }

    /// Lists stored checkpoints.
    ///
    /// A checkpoint that fails its integrity check is listed with status `corrupt`.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"executionId": "exec-1", "chainId": "orders", "status": "running", "nextIndex": 2,
    ///   "resumable": true, "createdAt": "2026-03-01T10:00:00Z"}]
    /// ```
    @GET
    public List<Map<String, Object>> list() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (String executionId : checkpoints.list()) {
            try {
                checkpoints.load(executionId).ifPresent(c -> entries.add(describe(c)));
            } catch (CheckpointIntegrityException e) {
                LOG.warnv("Checkpoint {0} failed verification: {1}", executionId, e.getMessage());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("executionId", executionId);
                entry.put("status", STATUS_CORRUPT);
                entry.put("resumable", false);
                entry.put("error", e.getMessage());
                entries.add(entry);
            }
        }
        return entries;
    }

    /// Deletes a checkpoint, e.g. after an operator gave up on a manual restart.
    @DELETE
    @Path("/{executionId}")
    public Response delete(@PathParam("executionId") @ValidId String executionId) {
        if (!checkpoints.delete(executionId)) {
            throw new NotFoundException("No checkpoint for: " + executionId);
        }
        LOG.infov("Checkpoint deleted: {0}", LogSanitizer.sanitize(executionId));
        return Response.noContent().build();
    }

    private static Map<String, Object> describe(Checkpoint checkpoint) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("executionId", checkpoint.executionId());
        entry.put("chainId", checkpoint.context().getChainId());
        entry.put("status", checkpoint.status().wireName());
        entry.put("nextIndex", checkpoint.nextIndex());
        entry.put("resumable", checkpoint.isResumable());
        entry.put("createdAt", checkpoint.createdAt().toString());
        return entry;
    }
}
