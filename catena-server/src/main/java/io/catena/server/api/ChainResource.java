package io.catena.server.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.ChainRegistry;
import io.catena.serialization.ChainSerializer;
import io.catena.server.validation.LogSanitizer;
import io.catena.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for chain definitions.
///
/// Chains are validated on registration: field bounds and routing targets by
/// {@link ChainDefinition}, sub-chain references by {@link ChainRegistry}. A chain
/// that fails validation is rejected with 400 and nothing is stored.
///
/// @see ChainSerializer for the JSON format
@Path("/api/v1/chains")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ChainResource {

    private static final Logger LOG = Logger.getLogger(ChainResource.class);

    private final ChainRegistry chainRegistry;
    private final ObjectMapper objectMapper;

    @Inject
    public ChainResource(ChainRegistry chainRegistry, ObjectMapper objectMapper) {
        this.chainRegistry = chainRegistry;
        this.objectMapper = objectMapper;
    }

    /// Registers or replaces a chain.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/chains
    /// Content-Type: application/json
    ///
    /// {"id": "orders", "steps": [{"id": "fetch", "target": "crm", "operation": "get"}]}
    /// ```
    ///
    /// ### Response (201 Created)
    /// ```json
    /// {"id": "orders", "steps": 1}
    /// ```
    @POST
    public Response register(@NotBlank(message = "Chain definition is required") String json) {
        ChainDefinition chain = ChainSerializer.fromJson(json);
        chainRegistry.register(chain);

        LOG.infov("Chain registered: {0}", LogSanitizer.sanitize(chain.getId()));
        return Response.status(Response.Status.CREATED).entity(summary(chain)).build();
    }

    /// Registers chains that reference each other in one all-or-nothing batch.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/chains/batch
    /// Content-Type: application/json
    ///
    /// [{"id": "orders", ...}, {"id": "billing", ...}]
    /// ```
    @POST
    @Path("/batch")
    public Response registerBatch(
            @NotBlank(message = "Chain definitions are required") String json) {
        List<ChainDefinition> chains = new ArrayList<>();
        for (JsonNode node : readArray(json)) {
            chains.add(ChainSerializer.fromJson(node.toString()));
        }
        chainRegistry.registerAll(chains);

        LOG.infov("Chain batch registered: {0} chains", chains.size());
        return Response.status(Response.Status.CREATED)
                .entity(chains.stream().map(ChainResource::summary).toList())
                .build();
    }

    /// Lists registered chains.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"id": "orders", "name": "Order intake", "steps": 3}]
    /// ```
    @GET
    public List<Map<String, Object>> list() {
        return chainRegistry.list().stream().map(ChainResource::summary).toList();
    }

    /// Returns the full definition of a chain.
    @GET
    @Path("/{chainId}")
    public Response get(@PathParam("chainId") @ValidId String chainId) {
        ChainDefinition chain = chainRegistry.require(chainId);
        return Response.ok(ChainSerializer.toJson(chain), MediaType.APPLICATION_JSON).build();
    }

    /// Removes a chain. Running executions of it are not affected.
    @DELETE
    @Path("/{chainId}")
    public Response delete(@PathParam("chainId") @ValidId String chainId) {
        if (!chainRegistry.remove(chainId)) {
            LOG.warnv("Chain not found: {0}", LogSanitizer.sanitize(chainId));
            throw new NotFoundException("Chain not found: " + chainId);
        }
        LOG.infov("Chain removed: {0}", LogSanitizer.sanitize(chainId));
        return Response.noContent().build();
    }

    private JsonNode readArray(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new BadRequestException("Expected a non-empty JSON array of chains");
        }
        return root;
    }

    private static Map<String, Object> summary(ChainDefinition chain) {
        return Map.of(
                "id", chain.getId(),
                "name", chain.getName() != null ? chain.getName() : chain.getId(),
                "steps", chain.getSteps().size());
    }
}
