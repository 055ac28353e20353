package io.catena.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.catena.core.CatenaConfig;
import io.catena.core.breaker.CircuitBreakerConfig;
import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.chain.InMemoryChainRepository;
import io.catena.core.chain.step.ChainCallStep;
import io.catena.core.chain.step.ModuleCallStep;
import io.catena.core.chain.step.Step;
import io.catena.core.invocation.ActionRequest;
import io.catena.core.invocation.ActionResponse;
import io.catena.core.invocation.RetryController;
import io.catena.core.invocation.StepInvoker;
import io.catena.core.routing.ConditionEvaluator;
import io.catena.core.routing.ConditionOperator;
import io.catena.core.routing.FieldCondition;
import io.catena.core.routing.RoutingResolver;
import io.catena.core.routing.RoutingRule;
import io.catena.core.template.PathTemplateResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ChainRunnerTest {

    private ExecutorService callExecutor;
    private CatenaConfig config;
    private ChainRegistry chains;
    private ChainRunner runner;
    private CancellationToken token;
    private CountDownLatch release;

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Function<ActionRequest, ActionResponse>> behaviours =
            new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        callExecutor = Executors.newCachedThreadPool();
        config =
                CatenaConfig.builder()
                        .defaultRetryCount(0)
                        .defaultRetryDelay(Duration.ofMillis(100))
                        .maxRecursionDepth(3)
                        .build();
        chains = new ChainRegistry(new InMemoryChainRepository());
        token = new CancellationToken();
        release = new CountDownLatch(1);

        var evaluator = new ConditionEvaluator();
        var templates = new PathTemplateResolver();
        var retryController =
                new RetryController(
                        new StepInvoker(this::dispatch, callExecutor),
                        new CircuitBreakerRegistry(CircuitBreakerConfig.DEFAULT),
                        config,
                        templates,
                        (delay, cancellation) -> false,
                        Clock.systemUTC());
        runner =
                new ChainRunner(
                        chains,
                        retryController,
                        new RoutingResolver(evaluator),
                        evaluator,
                        templates,
                        config,
                        Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        callExecutor.shutdownNow();
    }

    // -------------------------------------------------------------------------
    // Linear execution
    // -------------------------------------------------------------------------

    @Test
    void shouldRunStepsInOrderAndAppendOutputs() {
        // Given
        behaviours.put("total", request -> ActionResponse.success(Map.of("sum", 30)));
        behaviours.put(
                "format",
                request -> ActionResponse.success("Total " + request.params().get("amount")));
        var chain =
                chain("invoice",
                        module("fetch", "fetch").build(),
                        module("total", "total").build(),
                        module("format", "format")
                                .param("amount", "{step_total_output.sum}")
                                .build());

        // When
        ExecutionResult result = run(chain, Map.of());

        // Then
        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(calls).containsExactly("fetch", "total", "format");
        assertThat(result.steps())
                .extracting(StepResult::stepId)
                .containsExactly("fetch", "total", "format");
        assertThat(result.output())
                .containsKeys("step_fetch_output", "step_total_output", "step_format_output")
                .containsEntry("step_format_output", "Total 30");
    }

    @Test
    void shouldProjectOutputThroughTemplate() {
        behaviours.put("total", request -> ActionResponse.success(Map.of("sum", 30)));
        var chain =
                ChainDefinition.builder()
                        .id("invoice")
                        .step(module("total", "total").build())
                        .output("sum", "{step_total_output.sum}")
                        .output("label", "{input.customer}: {step_total_output.sum}")
                        .build();

        ExecutionResult result = run(chain, Map.of("customer", "ada"));

        assertThat(result.output())
                .containsOnly(Map.entry("sum", 30), Map.entry("label", "ada: 30"));
    }

    @Test
    void shouldSkipStepWhoseConditionDoesNotHold() {
        // Given
        var chain =
                chain("orders",
                        module("fetch", "fetch").build(),
                        module("vip", "vip")
                                .condition(
                                        FieldCondition.of(
                                                "input.tier", ConditionOperator.EQUALS, "gold"))
                                .build(),
                        module("ship", "ship").build());

        // When
        ExecutionResult result = run(chain, Map.of("tier", "basic"));

        // Then
        assertThat(calls).containsExactly("fetch", "ship");
        StepResult skipped = result.steps().get(1);
        assertThat(skipped.status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(skipped.skipReason()).isEqualTo("condition not met");
        assertThat(skipped.routing()).isNull();
        assertThat(result.output()).doesNotContainKey("step_vip_output");
    }

    // -------------------------------------------------------------------------
    // Routing
    // -------------------------------------------------------------------------

    @Nested
    class Routing {

        @Test
        void shouldSkipAheadAndRecordStepsInBetween() {
            // Given
            behaviours.put("score", request -> ActionResponse.success(Map.of("risk", 90)));
            var chain =
                    chain("orders",
                            module("score", "score")
                                    .routingRule(
                                            RoutingRule.skipTo(
                                                    "high-risk",
                                                    FieldCondition.of(
                                                            "step_score_output.risk",
                                                            ConditionOperator.GREATER_THAN,
                                                            50),
                                                    "review"))
                                    .build(),
                            module("auto-approve", "approve").build(),
                            module("notify", "notify").build(),
                            module("review", "review").build());

            // When
            ExecutionResult result = run(chain, Map.of());

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(calls).containsExactly("score", "review");
            assertThat(result.steps())
                    .extracting(StepResult::status)
                    .containsExactly(
                            StepStatus.COMPLETED,
                            StepStatus.SKIPPED,
                            StepStatus.SKIPPED,
                            StepStatus.COMPLETED);
            assertThat(result.steps().get(1).skipReason()).contains("high-risk");
            assertThat(result.steps().get(0).routing().matchedRuleId()).isEqualTo("high-risk");
        }

        @Test
        void shouldRunJumpedChainAndContinueWithItsOutput() {
            // Given
            behaviours.put("escalate", request -> ActionResponse.success(request.params()));
            chains.register(
                    chain("escalation",
                            module("escalate", "escalate")
                                    .param("order", "{input.order}")
                                    .param("source", "{input.source}")
                                    .build()));
            var chain =
                    chain("orders",
                            module("check", "check")
                                    .routingRule(
                                            RoutingRule.jumpTo(
                                                    "vip",
                                                    FieldCondition.of(
                                                            "input.tier",
                                                            ConditionOperator.EQUALS,
                                                            "gold"),
                                                    "escalation",
                                                    Map.of(
                                                            "order", "input.orderId",
                                                            "source", "=router")))
                                    .build(),
                            module("ship", "ship").build());
            chains.register(chain);

            // When
            ExecutionResult result = run(chain, Map.of("tier", "gold", "orderId", "o-1"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(calls).containsExactly("check", "escalate", "ship");
            assertThat(result.output().get(ChainRunner.jumpOutputVariable("check")))
                    .isEqualTo(
                            Map.of(
                                    "step_escalate_output",
                                    Map.of("order", "o-1", "source", "router")));
        }

        @Test
        void shouldStopChainWhenStopRuleMatches() {
            var chain =
                    chain("orders",
                            module("check", "check")
                                    .routingRule(
                                            RoutingRule.stop(
                                                    "halt", FieldCondition.exists("input.dryRun")))
                                    .build(),
                            module("ship", "ship").build());

            ExecutionResult result = run(chain, Map.of("dryRun", true));

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(calls).containsExactly("check");
            assertThat(result.steps()).hasSize(1);
        }
    }

    // -------------------------------------------------------------------------
    // Failures
    // -------------------------------------------------------------------------

    @Nested
    class Failures {

        @Test
        void shouldFailExecutionWhenStepFailsWithoutContinueOnError() {
            behaviours.put("charge", request -> ActionResponse.failure("card declined"));
            var chain =
                    chain("orders",
                            module("charge", "charge").build(),
                            module("ship", "ship").build());

            ExecutionResult result = run(chain, Map.of());

            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.errorType()).isEqualTo("external_call");
            assertThat(result.error()).contains("charge").contains("card declined");
            assertThat(calls).containsExactly("charge");
            assertThat(result.output()).isEmpty();
        }

        @Test
        void shouldContinueAfterFailureAndTreatMissingOutputAsAbsent() {
            // Given
            behaviours.put("charge", request -> ActionResponse.failure("card declined"));
            var chain =
                    chain("orders",
                            module("charge", "charge").continueOnError(true).build(),
                            module("retry-later", "queue")
                                    .condition(FieldCondition.notExists("step_charge_output"))
                                    .build());

            // When
            ExecutionResult result = run(chain, Map.of());

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(calls).containsExactly("charge", "queue");
            assertThat(result.steps().get(0).status()).isEqualTo(StepStatus.FAILED);
            assertThat(result.output()).doesNotContainKey("step_charge_output");
        }

        @Test
        void shouldLetRoutingRedirectFailedStep() {
            behaviours.put("charge", request -> ActionResponse.failure("card declined"));
            var chain =
                    chain("orders",
                            module("charge", "charge")
                                    .routingRule(
                                            RoutingRule.skipTo(
                                                    "on-failure",
                                                    FieldCondition.of(
                                                            "step.status",
                                                            ConditionOperator.EQUALS,
                                                            "failed"),
                                                    "apologise"))
                                    .build(),
                            module("ship", "ship").build(),
                            module("apologise", "apologise").build());

            ExecutionResult result = run(chain, Map.of());

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(calls).containsExactly("charge", "apologise");
        }

        @Test
        void shouldFailWholeExecutionWhenRecursionLimitIsExceeded() {
            // Given a chain calling itself
            var loop =
                    chain("loop",
                            ChainCallStep.builder().id("again").targetChainId("loop").build());
            chains.register(loop);

            // When
            ExecutionResult result = run(loop, Map.of());

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.errorType()).isEqualTo("max_recursion_depth");
        }

        @Test
        void shouldFailWholeExecutionWhenSubChainIsMissing() {
            chains.register(chain("child", module("work", "work").build()));
            var parent =
                    chain("parent",
                            ChainCallStep.builder().id("delegate").targetChainId("child").build());
            chains.register(parent);
            chains.remove("child");

            ExecutionResult result = run(parent, Map.of());

            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.errorType()).isEqualTo("chain_not_found");
        }

        @Test
        void shouldFailChainCallStepWhenSubChainFails() {
            behaviours.put("work", request -> ActionResponse.failure("broken"));
            chains.register(chain("child", module("work", "work").build()));
            var parent =
                    chain("parent",
                            ChainCallStep.builder()
                                    .id("delegate")
                                    .targetChainId("child")
                                    .continueOnError(true)
                                    .build(),
                            module("after", "after").build());
            chains.register(parent);

            ExecutionResult result = run(parent, Map.of());

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            StepResult delegate = result.steps().get(0);
            assertThat(delegate.status()).isEqualTo(StepStatus.FAILED);
            assertThat(delegate.errorType()).isEqualTo("external_call");
            assertThat(delegate.error()).contains("child");
        }
    }

    // -------------------------------------------------------------------------
    // Sub-chains, deadlines and cancellation
    // -------------------------------------------------------------------------

    @Test
    void shouldPassMappedInputToSubChainAndUseItsOutput() {
        // Given
        behaviours.put(
                "lookup",
                request -> ActionResponse.success(Map.of("sku", request.params().get("sku"))));
        chains.register(
                ChainDefinition.builder()
                        .id("inventory")
                        .step(module("lookup", "lookup").param("sku", "{input.sku}").build())
                        .output("found", "{step_lookup_output.sku}")
                        .build());
        var parent =
                chain("orders",
                        ChainCallStep.builder()
                                .id("stock")
                                .targetChainId("inventory")
                                .inputMapping(Map.of("sku", "input.items.0"))
                                .build());
        chains.register(parent);

        // When
        ExecutionResult result = run(parent, Map.of("items", List.of("sku-9")));

        // Then
        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.output()).containsEntry("step_stock_output", Map.of("found", "sku-9"));
    }

    @Test
    void shouldEndWithTimeoutWhenChainDeadlinePasses() {
        behaviours.put("slow", this::blockUntilReleased);
        var chain =
                ChainDefinition.builder()
                        .id("slow")
                        .timeout(Duration.ofSeconds(1))
                        .step(module("wait", "slow").timeout(Duration.ofSeconds(30)).build())
                        .build();

        ExecutionResult result = run(chain, Map.of());

        assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(result.errorType()).isEqualTo("timeout");
    }

    @Test
    void shouldEndCancelledAndKeepCommittedResults() {
        // Given
        behaviours.put(
                "slow",
                request -> {
                    token.cancel("operator");
                    return blockUntilReleased(request);
                });
        var chain =
                chain("orders",
                        module("fetch", "fetch").build(),
                        module("wait", "slow").build(),
                        module("ship", "ship").build());

        // When
        ExecutionResult result = run(chain, Map.of());

        // Then
        assertThat(result.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(result.error()).contains("operator");
        assertThat(result.steps()).extracting(StepResult::stepId).containsExactly("fetch");
        assertThat(calls).containsExactly("fetch", "slow");
    }

    // -------------------------------------------------------------------------
    // Listener and resume
    // -------------------------------------------------------------------------

    @Test
    void shouldReportCheckpointAfterEveryCommittedStep() {
        // Given
        ExecutionListener listener = mock(ExecutionListener.class);
        chains.register(chain("child", module("inner", "inner").build()));
        var chain =
                chain("orders",
                        module("fetch", "fetch").build(),
                        ChainCallStep.builder().id("delegate").targetChainId("child").build());
        chains.register(chain);

        // When
        runner.run(chain, context("orders"), token, listener);

        // Then
        InOrder order = inOrder(listener);
        order.verify(listener).onExecutionStarted(any(), eq(chain), eq(0));
        order.verify(listener).onCheckpoint(any(), eq(1), anyList());
        order.verify(listener).onCheckpoint(any(), eq(2), anyList());
        order.verify(listener).onExecutionCompleted(any());
        verify(listener, times(2)).onStepStarted(any(), any(Step.class));
        verify(listener, times(2)).onCheckpoint(any(), anyInt(), anyList());
    }

    @Test
    void shouldResumeAtNextIndexWithoutRerunningCompletedSteps() {
        // Given a checkpoint taken after the first two steps
        var chain =
                chain("orders",
                        module("fetch", "fetch").build(),
                        module("total", "total").build(),
                        module("ship", "ship").param("ref", "{step_fetch_output.op}").build());
        ExecutionContext restored =
                ExecutionContext.restore(
                        "exec-resumed",
                        "orders",
                        "t-1",
                        Map.of(),
                        Map.of(),
                        Map.of(
                                "step_fetch_output", Map.of("op", "fetch"),
                                "step_total_output", Map.of("op", "total")),
                        0,
                        0);
        var now = Instant.now();
        List<StepResult> prior =
                List.of(
                        StepResult.completed(
                                "fetch", now, now, Map.of("op", "fetch"), 0, List.of()),
                        StepResult.completed(
                                "total", now, now, Map.of("op", "total"), 0, List.of()));

        // When
        ExecutionResult result =
                runner.resume(chain, restored, 2, prior, token, ExecutionListener.NOOP);

        // Then
        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(calls).containsExactly("ship");
        assertThat(result.executionId()).isEqualTo("exec-resumed");
        assertThat(result.steps())
                .extracting(StepResult::stepId)
                .containsExactly("fetch", "total", "ship");
    }

    @Test
    void shouldRejectResumeIndexOutsideChain() {
        var chain = chain("orders", module("fetch", "fetch").build());
        var context = context("orders");

        assertThatThrownBy(
                        () ->
                                runner.resume(
                                        chain,
                                        context,
                                        5,
                                        List.of(),
                                        token,
                                        ExecutionListener.NOOP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ExecutionResult run(ChainDefinition chain, Map<String, Object> input) {
        var context = ExecutionContext.create("exec-test", chain.getId(), "t-1", input, Map.of());
        return runner.run(chain, context, token, ExecutionListener.NOOP);
    }

    private static ExecutionContext context(String chainId) {
        return ExecutionContext.create("exec-test", chainId, "t-1", Map.of(), Map.of());
    }

    private ActionResponse dispatch(ActionRequest request) {
        calls.add(request.operation());
        Function<ActionRequest, ActionResponse> behaviour = behaviours.get(request.operation());
        return behaviour != null
                ? behaviour.apply(request)
                : ActionResponse.success(Map.of("op", request.operation()));
    }

    private ActionResponse blockUntilReleased(ActionRequest request) {
        try {
            release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return ActionResponse.success("late");
    }

    private static ModuleCallStep.Builder module(String id, String operation) {
        return ModuleCallStep.builder().id(id).target("svc-" + operation).operation(operation);
    }

    private static ChainDefinition chain(String id, Step... steps) {
        return ChainDefinition.builder().id(id).steps(List.of(steps)).build();
    }
}
