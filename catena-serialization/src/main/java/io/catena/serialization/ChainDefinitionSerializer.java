package io.catena.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.Step;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `ChainDefinition` as
/// `{"id":"...","name":"...","description":"...","timeoutMs":N,"steps":[...],
/// "outputTemplate":{...}}`.
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see ChainDefinitionDeserializer for the inverse operation
class ChainDefinitionSerializer extends StdSerializer<ChainDefinition> {

    @Serial private static final long serialVersionUID = 6673521850372046147L;

    ChainDefinitionSerializer() {
        super(ChainDefinition.class);
    }

    @Override
    public void serialize(ChainDefinition chain, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", chain.getId());
        if (chain.getName() != null) {
            gen.writeStringField("name", chain.getName());
        }
        if (chain.getDescription() != null) {
            gen.writeStringField("description", chain.getDescription());
        }
        if (chain.getTimeout() != null) {
            gen.writeNumberField("timeoutMs", chain.getTimeout().toMillis());
        }

        gen.writeArrayFieldStart("steps");
        for (Step step : chain.getSteps()) {
            provider.defaultSerializeValue(step, gen);
        }
        gen.writeEndArray();

        if (!chain.getOutputTemplate().isEmpty()) {
            gen.writeObjectFieldStart("outputTemplate");
            for (Map.Entry<String, String> entry : chain.getOutputTemplate().entrySet()) {
                gen.writeStringField(entry.getKey(), entry.getValue());
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
