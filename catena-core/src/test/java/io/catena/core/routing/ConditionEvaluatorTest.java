package io.catena.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ConditionEvaluatorTest {

    private ConditionEvaluator evaluator;
    private Map<String, Object> variables;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator();
        variables =
                Map.of(
                        "step_fetch_output",
                        Map.of(
                                "status",
                                "ok",
                                "count",
                                3,
                                "ratio",
                                0.5,
                                "tags",
                                List.of("alpha", "beta"),
                                "message",
                                "order shipped"),
                        "input",
                        Map.of("region", "eu"));
    }

    @Nested
    class FieldConditions {

        @Test
        void shouldMatchEqualStrings() {
            var condition =
                    FieldCondition.of("step_fetch_output.status", ConditionOperator.EQUALS, "ok");

            assertThat(evaluator.evaluate(condition, variables)).isTrue();
        }

        @Test
        void shouldCompareNumbersByValue() {
            var condition =
                    FieldCondition.of("step_fetch_output.count", ConditionOperator.EQUALS, 3.0);

            assertThat(evaluator.evaluate(condition, variables)).isTrue();
        }

        @Test
        void shouldCompareNumberAgainstNumericString() {
            var condition =
                    FieldCondition.of("step_fetch_output.count", ConditionOperator.EQUALS, "3");

            assertThat(evaluator.evaluate(condition, variables)).isTrue();
        }

        @Test
        void shouldMatchSubstringAndListElement() {
            var substring =
                    FieldCondition.of(
                            "step_fetch_output.message", ConditionOperator.CONTAINS, "shipped");
            var element =
                    FieldCondition.of("step_fetch_output.tags", ConditionOperator.CONTAINS, "beta");
            var absent =
                    FieldCondition.of(
                            "step_fetch_output.tags", ConditionOperator.NOT_CONTAINS, "gamma");

            assertThat(evaluator.evaluate(substring, variables)).isTrue();
            assertThat(evaluator.evaluate(element, variables)).isTrue();
            assertThat(evaluator.evaluate(absent, variables)).isTrue();
        }

        @ParameterizedTest
        @MethodSource("io.catena.core.routing.ConditionEvaluatorTest#orderings")
        void shouldOrderNumbers(ConditionOperator operator, Object value, boolean expected) {
            var condition = FieldCondition.of("step_fetch_output.count", operator, value);

            assertThat(evaluator.evaluate(condition, variables)).isEqualTo(expected);
        }

        @Test
        void shouldNotOrderIncomparableValues() {
            var greater =
                    FieldCondition.of(
                            "step_fetch_output.tags", ConditionOperator.GREATER_THAN, 1);
            var less = FieldCondition.of("step_fetch_output.tags", ConditionOperator.LESS_THAN, 1);

            assertThat(evaluator.evaluate(greater, variables)).isFalse();
            assertThat(evaluator.evaluate(less, variables)).isFalse();
        }

        @Test
        void shouldOrderPlainStringsLexicographically() {
            var condition =
                    FieldCondition.of("input.region", ConditionOperator.LESS_THAN, "us");

            assertThat(evaluator.evaluate(condition, variables)).isTrue();
        }
    }

    @Nested
    class MissingFields {

        @Test
        void shouldHoldNotExistsForFieldNeverProduced() {
            // Given a failed step leaves no output variable behind
            Map<String, Object> afterFailure = Map.of("input", Map.of());

            // When
            boolean notExists =
                    evaluator.evaluate(
                            FieldCondition.notExists("step_charge_output.receipt"), afterFailure);
            boolean exists =
                    evaluator.evaluate(
                            FieldCondition.exists("step_charge_output.receipt"), afterFailure);

            // Then
            assertThat(notExists).isTrue();
            assertThat(exists).isFalse();
        }

        @Test
        void shouldFailComparisonsOnMissingField() {
            var equals = FieldCondition.of("nope", ConditionOperator.EQUALS, null);
            var notEquals = FieldCondition.of("nope", ConditionOperator.NOT_EQUALS, "x");

            assertThat(evaluator.evaluate(equals, variables)).isFalse();
            assertThat(evaluator.evaluate(notEquals, variables)).isFalse();
        }
    }

    @Nested
    class LogicGroups {

        private final Condition truthy =
                FieldCondition.of("input.region", ConditionOperator.EQUALS, "eu");
        private final Condition falsy =
                FieldCondition.of("input.region", ConditionOperator.EQUALS, "us");

        @Test
        void shouldFailAndGroupWhenAnyChildFails() {
            assertThat(evaluator.evaluate(LogicGroup.and(truthy, falsy, truthy), variables))
                    .isFalse();
            assertThat(evaluator.evaluate(LogicGroup.and(truthy, truthy), variables)).isTrue();
        }

        @Test
        void shouldPassOrGroupWhenAnyChildPasses() {
            assertThat(evaluator.evaluate(LogicGroup.or(falsy, truthy), variables)).isTrue();
            assertThat(evaluator.evaluate(LogicGroup.or(falsy, falsy), variables)).isFalse();
        }

        @Test
        void shouldEvaluateNestedGroups() {
            var condition = LogicGroup.or(falsy, LogicGroup.and(truthy, LogicGroup.or(truthy)));

            assertThat(evaluator.evaluate(condition, variables)).isTrue();
        }

        @Test
        void shouldTreatEmptyGroupsAsIdentity() {
            assertThat(evaluator.evaluate(LogicGroup.and(), variables)).isTrue();
            assertThat(evaluator.evaluate(LogicGroup.or(), variables)).isFalse();
        }
    }

    static Stream<Arguments> orderings() {
        return Stream.of(
                Arguments.of(ConditionOperator.GREATER_THAN, 2, true),
                Arguments.of(ConditionOperator.GREATER_THAN, 3, false),
                Arguments.of(ConditionOperator.GREATER_OR_EQUAL, 3, true),
                Arguments.of(ConditionOperator.LESS_THAN, "10", true),
                Arguments.of(ConditionOperator.LESS_OR_EQUAL, 2.5, false));
    }
}
