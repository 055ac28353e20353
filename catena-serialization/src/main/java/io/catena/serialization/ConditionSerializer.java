package io.catena.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.catena.core.routing.Condition;
import io.catena.core.routing.FieldCondition;
import io.catena.core.routing.LogicGroup;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `Condition` sealed hierarchy.
///
/// Emitted JSON shape per subtype:
/// - **`FieldCondition`**: `{"field":"...","operator":"greater_than","value":...}`, `value`
///   omitted when null
/// - **`LogicGroup`**: `{"logic":"AND","conditions":[...]}`, children written recursively
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see ConditionDeserializer for the inverse operation
class ConditionSerializer extends StdSerializer<Condition> {

    @Serial private static final long serialVersionUID = 3319640722170215881L;

    ConditionSerializer() {
        super(Condition.class);
    }

    @Override
    public void serialize(Condition condition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (condition instanceof FieldCondition field) {
            gen.writeStringField("field", field.field());
            gen.writeStringField("operator", field.operator().wireName());
            if (field.value() != null) {
                gen.writeFieldName("value");
                provider.defaultSerializeValue(field.value(), gen);
            }
        } else {
            LogicGroup group = (LogicGroup) condition;
            gen.writeStringField("logic", group.logic().name());
            gen.writeArrayFieldStart("conditions");
            for (Condition child : group.conditions()) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
