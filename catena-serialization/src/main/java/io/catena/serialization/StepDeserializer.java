package io.catena.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.chain.step.StepType;
import io.catena.core.routing.RoutingRule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes JSON to the `Step` subtype named by the `"type"` discriminator field.
///
/// A missing `"type"` means `module_call`. Field bounds are not checked here; they are
/// enforced when the owning {@link io.catena.core.chain.ChainDefinition} is built.
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see StepSerializer for the inverse operation
class StepDeserializer extends StdDeserializer<Step> {

    @Serial private static final long serialVersionUID = 2043117754009541790L;

    StepDeserializer() {
        super(Step.class);
    }

    @Override
    public Step deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    static Step read(ObjectMapper mapper, JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Step must be a JSON object");
        }
        String type = JsonFields.text(node, "type");
        StepType stepType = type != null ? StepType.fromWireName(type) : StepType.MODULE_CALL;

        return switch (stepType) {
            case MODULE_CALL -> {
                ModuleCallStep.Builder builder =
                        ModuleCallStep.builder()
                                .target(JsonFields.requireText(node, "target"))
                                .operation(JsonFields.requireText(node, "operation"))
                                .params(JsonFields.objectMap(mapper, node, "params"));
                yield common(mapper, node, builder).build();
            }
            case CHAIN_CALL -> {
                ChainCallStep.Builder builder =
                        ChainCallStep.builder()
                                .targetChainId(JsonFields.requireText(node, "targetChainId"))
                                .inputMapping(JsonFields.stringMap(mapper, node, "inputMapping"));
                yield common(mapper, node, builder).build();
            }
        };
    }

    private static <T extends Step, B extends Step.Builder<T, B>> B common(
            ObjectMapper mapper, JsonNode node, B builder) throws IOException {
        builder.id(JsonFields.requireText(node, "id"))
                .name(JsonFields.text(node, "name"))
                .timeout(JsonFields.millis(node, "timeoutMs"))
                .retryCount(JsonFields.integer(node, "retryCount"))
                .retryDelay(JsonFields.millis(node, "retryDelayMs"))
                .continueOnError(node.path("continueOnError").asBoolean(false));
        if (node.hasNonNull("condition")) {
            builder.condition(ConditionDeserializer.read(mapper, node.get("condition")));
        }
        JsonNode rules = node.get("routingRules");
        if (rules != null && rules.isArray()) {
            List<RoutingRule> parsed = new ArrayList<>();
            for (JsonNode rule : rules) {
                parsed.add(RoutingRuleDeserializer.read(mapper, rule));
            }
            builder.routingRules(parsed);
        }
        return builder;
    }
}
