package io.catena.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.catena.core.checkpoint.Checkpoint;
import io.catena.core.checkpoint.CheckpointCodec;
import io.catena.core.checkpoint.CheckpointStatus;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.StepResult;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Checkpoint payload codec writing compact JSON.
///
/// Payload shape:
/// {@snippet lang=json :
/// {
///   "version": 1,
///   "context": { "executionId": "exec-...", "chainId": "...", "variables": { } },
///   "nextIndex": 3,
///   "results": [ { "stepId": "fetch", "status": "completed" } ],
///   "status": "running",
///   "createdAt": "2026-03-01T10:00:00Z"
/// }
/// }
///
/// @implNote Thread-safe; the mapper is shared and only read after construction.
public final class JacksonCheckpointCodec implements CheckpointCodec {

    static final int FORMAT_VERSION = 1;

    private static final TypeReference<List<StepResult>> RESULT_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonCheckpointCodec() {
        this(ChainSerializer.createMapper());
    }

    public JacksonCheckpointCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public byte[] encode(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        ObjectNode root = mapper.createObjectNode();
        root.put("version", FORMAT_VERSION);
        root.set("context", mapper.valueToTree(checkpoint.context()));
        root.put("nextIndex", checkpoint.nextIndex());
        root.set("results", mapper.valueToTree(checkpoint.results()));
        root.put("status", checkpoint.status().wireName());
        root.put("createdAt", checkpoint.createdAt().toString());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Cannot encode checkpoint of " + checkpoint.executionId(), e);
        }
    }

    /// {@inheritDoc}
    ///
    /// @throws IllegalArgumentException if the payload is not a checkpoint document of a
    ///     supported version
    @Override
    public Checkpoint decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            JsonNode root = mapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Checkpoint payload is not a JSON object");
            }
            int version = root.path("version").asInt(-1);
            if (version != FORMAT_VERSION) {
                throw new IllegalArgumentException(
                        "Unsupported checkpoint format version: " + version);
            }
            ExecutionContext context =
                    mapper.treeToValue(root.get("context"), ExecutionContext.class);
            List<StepResult> results =
                    mapper.convertValue(root.get("results"), RESULT_LIST);
            return new Checkpoint(
                    context,
                    root.path("nextIndex").asInt(),
                    results,
                    CheckpointStatus.fromWireName(JsonFields.requireText(root, "status")),
                    Instant.parse(JsonFields.requireText(root, "createdAt")));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Checkpoint payload is malformed", e);
        }
    }
}
