package io.catena.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.catena.core.routing.RoutingAction;
import io.catena.core.routing.RoutingRule;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `RoutingRule`; the action is resolved from its snake case name.
///
/// @see RoutingRuleSerializer for the inverse operation
class RoutingRuleDeserializer extends StdDeserializer<RoutingRule> {

    @Serial private static final long serialVersionUID = -6030263829150947720L;

    RoutingRuleDeserializer() {
        super(RoutingRule.class);
    }

    @Override
    public RoutingRule deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    static RoutingRule read(ObjectMapper mapper, JsonNode node) throws IOException {
        return new RoutingRule(
                JsonFields.requireText(node, "id"),
                ConditionDeserializer.read(mapper, node.get("condition")),
                RoutingAction.fromWireName(JsonFields.requireText(node, "action")),
                JsonFields.text(node, "target"),
                JsonFields.text(node, "description"),
                JsonFields.stringMap(mapper, node, "inputMapping"));
    }
}
