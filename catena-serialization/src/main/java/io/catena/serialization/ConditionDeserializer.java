package io.catena.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.catena.core.routing.Condition;
import io.catena.core.routing.ConditionOperator;
import io.catena.core.routing.FieldCondition;
import io.catena.core.routing.LogicGroup;
import io.catena.core.routing.LogicOperator;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Deserializes a `Condition`, telling the variants apart by shape: an object with a
/// `"logic"` field is a `LogicGroup`, anything else a `FieldCondition`.
///
/// `"logic"` is matched case-insensitively. Unknown operators are rejected with a
/// {@link io.catena.core.exception.ValidationException}.
///
/// @see ConditionSerializer for the inverse operation
class ConditionDeserializer extends StdDeserializer<Condition> {

    @Serial private static final long serialVersionUID = -2771031862493020413L;

    ConditionDeserializer() {
        super(Condition.class);
    }

    @Override
    public Condition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    static Condition read(ObjectMapper mapper, JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Condition must be a JSON object");
        }
        if (node.has("logic")) {
            LogicOperator logic =
                    LogicOperator.valueOf(
                            JsonFields.requireText(node, "logic").toUpperCase(Locale.ROOT));
            List<Condition> children = new ArrayList<>();
            JsonNode conditions = node.get("conditions");
            if (conditions != null) {
                for (JsonNode child : conditions) {
                    children.add(read(mapper, child));
                }
            }
            return new LogicGroup(logic, children);
        }

        ConditionOperator operator =
                ConditionOperator.fromWireName(JsonFields.requireText(node, "operator"));
        Object value =
                node.has("value") ? mapper.treeToValue(node.get("value"), Object.class) : null;
        return new FieldCondition(JsonFields.requireText(node, "field"), operator, value);
    }
}
