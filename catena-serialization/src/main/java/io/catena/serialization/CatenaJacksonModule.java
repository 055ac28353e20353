package io.catena.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.catena.core.breaker.CircuitState;
import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.Step;
import io.catena.core.checkpoint.CheckpointStatus;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepResult;
import io.catena.core.execution.StepStatus;
import io.catena.core.routing.Condition;
import io.catena.core.routing.RoutingRule;
import io.catena.core.routing.RoutingTrace;
import io.catena.serialization.mixin.ResultMixin;
import io.catena.serialization.mixin.RoutingTraceMixin;
import io.catena.serialization.mixin.WireNameEnumMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Catena serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs** (builder-built or sealed types, read from the
/// JSON tree without reflection):
/// - `ChainDefinition`
/// - `Step`, discriminator: `"type"` (`module_call` | `chain_call`)
/// - `RoutingRule`
/// - `Condition`, told apart by shape (`"logic"` marks a group)
/// - `ExecutionContext`
///
/// **Mixins** (records and enums mapped by Jackson itself):
/// - `StepResult`, `ExecutionResult`: derived accessors hidden, nulls omitted
/// - `RoutingTrace`: derived accessors hidden
/// - status enums: written and read by their lower snake case wire name
///
/// @see ChainSerializer for the convenience factory API
public class CatenaJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5290815216403541126L;

    public CatenaJacksonModule() {
        super("CatenaJacksonModule");

        addSerializer(ChainDefinition.class, new ChainDefinitionSerializer());
        addDeserializer(ChainDefinition.class, new ChainDefinitionDeserializer());

        addSerializer(Step.class, new StepSerializer());
        addDeserializer(Step.class, new StepDeserializer());

        addSerializer(RoutingRule.class, new RoutingRuleSerializer());
        addDeserializer(RoutingRule.class, new RoutingRuleDeserializer());

        addSerializer(Condition.class, new ConditionSerializer());
        addDeserializer(Condition.class, new ConditionDeserializer());

        addSerializer(ExecutionContext.class, new ExecutionContextSerializer());
        addDeserializer(ExecutionContext.class, new ExecutionContextDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(StepResult.class, ResultMixin.class);
        context.setMixInAnnotations(ExecutionResult.class, ResultMixin.class);
        context.setMixInAnnotations(RoutingTrace.class, RoutingTraceMixin.class);

        context.setMixInAnnotations(StepStatus.class, WireNameEnumMixin.class);
        context.setMixInAnnotations(ExecutionStatus.class, WireNameEnumMixin.class);
        context.setMixInAnnotations(CheckpointStatus.class, WireNameEnumMixin.class);
        context.setMixInAnnotations(CircuitState.class, WireNameEnumMixin.class);
    }
}
