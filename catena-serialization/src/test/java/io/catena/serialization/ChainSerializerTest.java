package io.catena.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.exception.ValidationException;
import io.catena.core.routing.ConditionOperator;
import io.catena.core.routing.FieldCondition;
import io.catena.core.routing.LogicGroup;
import io.catena.core.routing.LogicOperator;
import io.catena.core.routing.RoutingAction;
import io.catena.core.routing.RoutingRule;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChainSerializerTest {

    private static final String ORDER_CHAIN =
            """
            {
              "id": "orders",
              "name": "Order intake",
              "timeoutMs": 60000,
              "steps": [
                {
                  "id": "score",
                  "target": "risk",
                  "operation": "score",
                  "params": {"order": "{input.orderId}", "limit": 3},
                  "retryCount": 2,
                  "retryDelayMs": 500,
                  "routingRules": [
                    {
                      "id": "high-risk",
                      "condition": {
                        "logic": "and",
                        "conditions": [
                          {
                            "field": "step_score_output.risk",
                            "operator": "greater_than",
                            "value": 50
                          },
                          {"field": "input.vip", "operator": "not_exists"}
                        ]
                      },
                      "action": "skip_to_step",
                      "target": "review"
                    }
                  ]
                },
                {
                  "type": "chain_call",
                  "id": "billing",
                  "targetChainId": "billing",
                  "inputMapping": {"amount": "input.total", "source": "=intake"},
                  "continueOnError": true
                },
                {
                  "id": "review",
                  "target": "crm",
                  "operation": "review",
                  "condition": {"field": "input.manual", "operator": "equals", "value": true}
                }
              ],
              "outputTemplate": {"risk": "{step_score_output.risk}"},
              "futureField": "ignored"
            }
            """;

    @Nested
    class Reading {

        @Test
        void shouldReadEveryPartOfDefinition() {
            // When
            ChainDefinition chain = ChainSerializer.fromJson(ORDER_CHAIN);

            // Then
            assertThat(chain.getId()).isEqualTo("orders");
            assertThat(chain.getName()).isEqualTo("Order intake");
            assertThat(chain.getTimeout()).isEqualTo(Duration.ofMinutes(1));
            assertThat(chain.getOutputTemplate()).containsEntry("risk", "{step_score_output.risk}");
            assertThat(chain.getSteps()).hasSize(3);

            var score = (ModuleCallStep) chain.getSteps().get(0);
            assertThat(score.getTarget()).isEqualTo("risk");
            assertThat(score.getParams()).containsEntry("limit", 3);
            assertThat(score.getRetryCount()).isEqualTo(2);
            assertThat(score.getRetryDelay()).isEqualTo(Duration.ofMillis(500));

            RoutingRule rule = score.getRoutingRules().get(0);
            assertThat(rule.action()).isEqualTo(RoutingAction.SKIP_TO_STEP);
            assertThat(rule.target()).isEqualTo("review");
            assertThat(rule.condition())
                    .isEqualTo(
                            new LogicGroup(
                                    LogicOperator.AND,
                                    List.of(
                                            FieldCondition.of(
                                                    "step_score_output.risk",
                                                    ConditionOperator.GREATER_THAN,
                                                    50),
                                            FieldCondition.notExists("input.vip"))));
        }

        @Test
        void shouldReadChainCallStep() {
            ChainDefinition chain = ChainSerializer.fromJson(ORDER_CHAIN);

            var billing = (ChainCallStep) chain.getSteps().get(1);

            assertThat(billing.getTargetChainId()).isEqualTo("billing");
            assertThat(billing.getInputMapping())
                    .containsEntry("amount", "input.total")
                    .containsEntry("source", "=intake");
            assertThat(billing.isContinueOnError()).isTrue();
        }

        @Test
        void shouldReadStepCondition() {
            ChainDefinition chain = ChainSerializer.fromJson(ORDER_CHAIN);

            assertThat(chain.getSteps().get(2).getCondition())
                    .isEqualTo(FieldCondition.of("input.manual", ConditionOperator.EQUALS, true));
        }
    }

    @Nested
    class Writing {

        @Test
        void shouldPreserveDefinitionThroughJson() {
            // Given
            ChainDefinition original = ChainSerializer.fromJson(ORDER_CHAIN);

            // When
            ChainDefinition restored = ChainSerializer.fromJson(ChainSerializer.toJson(original));

            // Then
            assertThat(restored.getSteps())
                    .extracting(step -> step.getId())
                    .containsExactly("score", "billing", "review");
            assertThat(restored.getSteps().get(0).getRoutingRules())
                    .isEqualTo(original.getSteps().get(0).getRoutingRules());
            assertThat(restored.getTimeout()).isEqualTo(original.getTimeout());
            assertThat(restored.getOutputTemplate()).isEqualTo(original.getOutputTemplate());
        }

        @Test
        void shouldWriteWireNames() {
            ChainDefinition chain = ChainSerializer.fromJson(ORDER_CHAIN);

            String json = ChainSerializer.toJson(chain);

            assertThat(json)
                    .contains("\"type\" : \"chain_call\"")
                    .contains("\"action\" : \"skip_to_step\"")
                    .contains("\"operator\" : \"greater_than\"")
                    .doesNotContain("futureField");
        }
    }

    @Nested
    class Rejection {

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> ChainSerializer.fromJson("{\"id\": "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize chain");
        }

        @Test
        void shouldRejectMissingStepTarget() {
            var json = "{\"id\":\"c\",\"steps\":[{\"id\":\"a\",\"operation\":\"x\"}]}";

            assertThatThrownBy(() -> ChainSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("target");
        }

        @Test
        void shouldRejectUnknownOperator() {
            var json =
                    "{\"id\":\"c\",\"steps\":[{\"id\":\"a\",\"target\":\"t\",\"operation\":\"x\","
                            + "\"condition\":{\"field\":\"f\",\"operator\":\"like\"}}]}";

            assertThatThrownBy(() -> ChainSerializer.fromJson(json))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("like");
        }

        @Test
        void shouldRejectDefinitionBreakingChainRules() {
            var json =
                    "{\"id\":\"c\",\"steps\":[{\"id\":\"a\",\"target\":\"t\",\"operation\":\"x\","
                            + "\"timeoutMs\":10}]}";

            assertThatThrownBy(() -> ChainSerializer.fromJson(json))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("step timeout");
        }

        @Test
        void shouldRejectEmptyChain() {
            assertThatThrownBy(() -> ChainSerializer.fromJson("{\"id\":\"c\",\"steps\":[]}"))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
