package io.catena.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.catena.core.execution.ExecutionContext;
import java.io.IOException;
import java.io.Serial;

/// Serializes the persisted state of an `ExecutionContext`: ids, input, environment,
/// variables, depth and retries used.
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see ExecutionContextDeserializer for the inverse operation
class ExecutionContextSerializer extends StdSerializer<ExecutionContext> {

    @Serial private static final long serialVersionUID = -1935186245590542196L;

    ExecutionContextSerializer() {
        super(ExecutionContext.class);
    }

    @Override
    public void serialize(ExecutionContext context, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("executionId", context.getExecutionId());
        gen.writeStringField("chainId", context.getChainId());
        if (context.getTriggerId() != null) {
            gen.writeStringField("triggerId", context.getTriggerId());
        }
        gen.writeFieldName("input");
        provider.defaultSerializeValue(context.getInput(), gen);
        gen.writeFieldName("env");
        provider.defaultSerializeValue(context.getEnv(), gen);
        gen.writeFieldName("variables");
        provider.defaultSerializeValue(context.getVariables(), gen);
        gen.writeNumberField("depth", context.getDepth());
        gen.writeNumberField("retriesUsed", context.getRetriesUsed());
        gen.writeEndObject();
    }
}
