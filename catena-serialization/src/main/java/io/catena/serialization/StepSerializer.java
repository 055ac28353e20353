package io.catena.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.routing.RoutingRule;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes the `Step` sealed hierarchy with a `"type"` discriminator field.
///
/// Common fields: `type`, `id`, `name`, `timeoutMs`, `retryCount`, `retryDelayMs`,
/// `continueOnError`, `condition`, `routingRules`. Unset optional fields are omitted.
///
/// Variant fields:
/// - **`module_call`**: `target`, `operation`, `params`
/// - **`chain_call`**: `targetChainId`, `inputMapping`
///
/// Durations are written as whole milliseconds.
///
/// @implNote Package-private. Registered by {@link CatenaJacksonModule}.
/// @see StepDeserializer for the inverse operation
class StepSerializer extends StdSerializer<Step> {

    @Serial private static final long serialVersionUID = -4655026707711938129L;

    StepSerializer() {
        super(Step.class);
    }

    @Override
    public void serialize(Step step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", step.getStepType().wireName());
        gen.writeStringField("id", step.getId());
        if (step.getName() != null) {
            gen.writeStringField("name", step.getName());
        }

        if (step instanceof ModuleCallStep call) {
            gen.writeStringField("target", call.getTarget());
            gen.writeStringField("operation", call.getOperation());
            if (!call.getParams().isEmpty()) {
                gen.writeFieldName("params");
                provider.defaultSerializeValue(call.getParams(), gen);
            }
        } else {
            ChainCallStep call = (ChainCallStep) step;
            gen.writeStringField("targetChainId", call.getTargetChainId());
            if (!call.getInputMapping().isEmpty()) {
                gen.writeObjectFieldStart("inputMapping");
                for (Map.Entry<String, String> entry : call.getInputMapping().entrySet()) {
                    gen.writeStringField(entry.getKey(), entry.getValue());
                }
                gen.writeEndObject();
            }
        }

        if (step.getTimeout() != null) {
            gen.writeNumberField("timeoutMs", step.getTimeout().toMillis());
        }
        if (step.getRetryCount() != null) {
            gen.writeNumberField("retryCount", step.getRetryCount());
        }
        if (step.getRetryDelay() != null) {
            gen.writeNumberField("retryDelayMs", step.getRetryDelay().toMillis());
        }
        if (step.isContinueOnError()) {
            gen.writeBooleanField("continueOnError", true);
        }
        if (step.getCondition() != null) {
            gen.writeFieldName("condition");
            provider.defaultSerializeValue(step.getCondition(), gen);
        }
        if (!step.getRoutingRules().isEmpty()) {
            gen.writeArrayFieldStart("routingRules");
            for (RoutingRule rule : step.getRoutingRules()) {
                provider.defaultSerializeValue(rule, gen);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
