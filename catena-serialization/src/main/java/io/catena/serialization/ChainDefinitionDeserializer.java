package io.catena.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.catena.core.chain.ChainDefinition;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `ChainDefinition` through its builder.
///
/// Steps, conditions and routing rules are read from the same tree rather than through
/// nested `readValue` calls, so a definition that breaks a chain invariant surfaces as
/// the {@link io.catena.core.exception.ValidationException} raised by
/// {@link ChainDefinition.Builder#build()}.
///
/// @see ChainDefinitionSerializer for the inverse operation
class ChainDefinitionDeserializer extends StdDeserializer<ChainDefinition> {

    @Serial private static final long serialVersionUID = 1490270993419517312L;

    ChainDefinitionDeserializer() {
        super(ChainDefinition.class);
    }

    @Override
    public ChainDefinition deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw new IOException("Chain definition must be a JSON object");
        }

        ChainDefinition.Builder builder =
                ChainDefinition.builder()
                        .id(JsonFields.requireText(root, "id"))
                        .name(JsonFields.text(root, "name"))
                        .description(JsonFields.text(root, "description"))
                        .timeout(JsonFields.millis(root, "timeoutMs"))
                        .outputTemplate(JsonFields.stringMap(mapper, root, "outputTemplate"));

        JsonNode steps = root.get("steps");
        if (steps != null && steps.isArray()) {
            for (JsonNode step : steps) {
                builder.step(StepDeserializer.read(mapper, step));
            }
        }
        return builder.build();
    }
}
