package io.catena.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.catena.core.execution.ExecutionContext;
import java.io.IOException;
import java.io.Serial;

/// Rebuilds an `ExecutionContext` with {@link ExecutionContext#restore}.
///
/// @see ExecutionContextSerializer for the inverse operation
class ExecutionContextDeserializer extends StdDeserializer<ExecutionContext> {

    @Serial private static final long serialVersionUID = 4410325781406625523L;

    ExecutionContextDeserializer() {
        super(ExecutionContext.class);
    }

    @Override
    public ExecutionContext deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        return ExecutionContext.restore(
                JsonFields.requireText(root, "executionId"),
                JsonFields.requireText(root, "chainId"),
                JsonFields.text(root, "triggerId"),
                JsonFields.objectMap(mapper, root, "input"),
                JsonFields.stringMap(mapper, root, "env"),
                JsonFields.objectMap(mapper, root, "variables"),
                root.path("depth").asInt(0),
                root.path("retriesUsed").asInt(0));
    }
}
