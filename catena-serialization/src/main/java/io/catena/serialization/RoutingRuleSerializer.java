package io.catena.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.catena.core.routing.RoutingRule;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `RoutingRule` as
/// `{"id":"...","condition":{...},"action":"skip_to_step","target":"...",
/// "description":"...","inputMapping":{...}}`.
///
/// `target`, `description` and an empty `inputMapping` are omitted.
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see RoutingRuleDeserializer for the inverse operation
class RoutingRuleSerializer extends StdSerializer<RoutingRule> {

    @Serial private static final long serialVersionUID = 8216470231893102244L;

    RoutingRuleSerializer() {
        super(RoutingRule.class);
    }

    @Override
    public void serialize(RoutingRule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", rule.id());
        gen.writeFieldName("condition");
        provider.defaultSerializeValue(rule.condition(), gen);
        gen.writeStringField("action", rule.action().wireName());
        if (rule.target() != null) {
            gen.writeStringField("target", rule.target());
        }
        if (rule.description() != null) {
            gen.writeStringField("description", rule.description());
        }
        if (!rule.inputMapping().isEmpty()) {
            gen.writeObjectFieldStart("inputMapping");
            for (Map.Entry<String, String> entry : rule.inputMapping().entrySet()) {
                gen.writeStringField(entry.getKey(), entry.getValue());
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
