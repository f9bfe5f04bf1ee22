package com.pandora.orchestrator.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.claude.ModelInvoker;
import com.pandora.orchestrator.evidence.EvidenceBuilderRegistry;
import com.pandora.orchestrator.evidence.EvidenceBundle;
import com.pandora.orchestrator.evidence.SkillEvidenceBuilder;
import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.function.StepFunctionTable;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.StepDefinition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * SkillRuntime against real StepExecutor and StepGraph, with compute
 * functions defined inline. Only persistence and the model are mocked.
 */
@ExtendWith(MockitoExtension.class)
class SkillRuntimeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-04T10:00:00Z"), ZoneOffset.UTC);

    @Mock SkillRunRecorder recorder;
    @Mock ModelInvoker     modelInvoker;

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<StepFunction> functions = new ArrayList<>();
    private final List<SkillEvidenceBuilder> evidenceBuilders = new ArrayList<>();
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        functions.add(fn("emit", (args, ctx) -> Map.of("value", 1)));
        functions.add(fn("boom", (args, ctx) -> { throw new IllegalStateException("source unavailable"); }));
        functions.add(fn("echoArgs", (args, ctx) -> Map.copyOf(args)));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) pool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Ordering and exactly-once
    // ------------------------------------------------------------------

    @Test
    void execute_linearChain_eachStepRunsOnceAndOutputsAreVisible() {
        SkillDefinition skill = skill(
                StepDefinition.compute("a", "emit", "a_out", Map.of()),
                StepDefinition.compute("b", "emit", "b_out", Map.of(), "a"),
                StepDefinition.compute("c", "echoArgs", "c_out", Map.of(), "b"));

        SkillRunResult result = runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.outputs()).containsKeys("a_out", "b_out", "c_out");
        assertThat(calls.get("emit").get()).isEqualTo(2);
        assertThat(calls.get("echoArgs").get()).isEqualTo(1);
        @SuppressWarnings("unchecked")
        Map<String, Object> seen = (Map<String, Object>) result.outputs().get("c_out");
        assertThat(seen).containsKeys("a_out", "b_out").containsEntry("workspaceId", "ws-1");
        assertThat(result.finalOutput()).isEqualTo(seen);
        verify(recorder).started(any(), anyString(), any());
        verify(recorder).finished(any(), anyString(), any(), any());
    }

    @Test
    void execute_outputsListedInDeclarationOrder() {
        pool = Executors.newFixedThreadPool(4);
        SkillDefinition skill = skill(
                StepDefinition.compute("z", "emit", "z_out", Map.of()),
                StepDefinition.compute("a", "emit", "a_out", Map.of()),
                StepDefinition.compute("m", "emit", "m_out", Map.of()),
                StepDefinition.compute("q", "emit", "q_out", Map.of(), "z", "a"));

        SkillRunResult result = runtime(pool).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.outputs().keySet()).containsExactly("z_out", "a_out", "m_out", "q_out");
    }

    @Test
    void execute_diamondOnPool_everyStepRunsExactlyOnce() {
        pool = Executors.newFixedThreadPool(4);
        SkillDefinition skill = skill(
                StepDefinition.compute("root", "count-root", "root_out", Map.of()),
                StepDefinition.compute("left", "count-left", "left_out", Map.of(), "root"),
                StepDefinition.compute("right", "count-right", "right_out", Map.of(), "root"),
                StepDefinition.compute("join", "count-join", "join_out", Map.of(), "left", "right"));
        for (String name : List.of("count-root", "count-left", "count-right", "count-join")) {
            functions.add(fn(name, (args, ctx) -> Map.of("keys", args.keySet().size())));
        }

        for (int i = 0; i < 20; i++) {
            SkillRunResult result = runtime(pool).execute(skill, RunRequest.onDemand("ws-1", Map.of()));
            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.outputs()).containsKey("join_out");
        }

        assertThat(calls.get("count-root").get()).isEqualTo(20);
        assertThat(calls.get("count-left").get()).isEqualTo(20);
        assertThat(calls.get("count-right").get()).isEqualTo(20);
        assertThat(calls.get("count-join").get()).isEqualTo(20);
    }

    // ------------------------------------------------------------------
    // Failure isolation
    // ------------------------------------------------------------------

    @Test
    void execute_failedStep_skipsDependentsButSiblingBranchStillRuns() {
        SkillDefinition skill = skill(
                StepDefinition.compute("a", "emit", "a_out", Map.of()),
                StepDefinition.compute("b", "boom", "b_out", Map.of(), "a"),
                StepDefinition.compute("c", "emit", "c_out", Map.of(), "b"),
                StepDefinition.compute("d", "echoArgs", "d_out", Map.of(), "a"));

        SkillRunResult result = runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.stepStatus("a")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.stepStatus("b")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepStatus("c")).isEqualTo(StepStatus.SKIPPED);
        assertThat(result.stepStatus("d")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.steps().get("b").errorType()).isEqualTo("FUNCTION_ERROR");
        assertThat(result.steps().get("c").error()).contains("'b'");
        assertThat(result.outputs()).doesNotContainKeys("b_out", "c_out");
        assertThat(result.errors()).singleElement().asString().startsWith("b:").contains("source unavailable");
    }

    @Test
    void execute_unknownFunction_failsOnlyThatStep() {
        SkillDefinition skill = skill(
                StepDefinition.compute("a", "doesNotExist", "a_out", Map.of()),
                StepDefinition.compute("b", "emit", "b_out", Map.of()));

        SkillRunResult result = runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.steps().get("a").status()).isEqualTo(StepStatus.FAILED);
        assertThat(result.steps().get("a").errorType()).isEqualTo("UNKNOWN_FUNCTION");
        assertThat(result.stepStatus("b")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void execute_cycle_throwsBeforeAnyStepRuns() {
        SkillDefinition skill = skill(
                StepDefinition.compute("a", "emit", "a_out", Map.of(), "b"),
                StepDefinition.compute("b", "emit", "b_out", Map.of(), "a"));

        assertThatThrownBy(() -> runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of())))
                .isInstanceOf(InvalidGraphException.class);

        assertThat(calls).isEmpty();
        verifyNoInteractions(recorder);
    }

    // ------------------------------------------------------------------
    // Arguments and evidence
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void execute_runParamsOverrideStaticArgs() {
        SkillDefinition skill = skill(
                StepDefinition.compute("a", "echoArgs", "a_out", Map.of("staleDays", 14, "topN", 5)));

        SkillRunResult result = runtime(Runnable::run)
                .execute(skill, RunRequest.onDemand("ws-1", Map.of("staleDays", 30)));

        assertThat((Map<String, Object>) result.outputs().get("a_out"))
                .containsEntry("staleDays", 30)
                .containsEntry("topN", 5);
    }

    @Test
    void execute_evidenceBuilderSeesOutputs() {
        evidenceBuilders.add(new SkillEvidenceBuilder() {
            @Override public String skillId() { return "s"; }
            @Override public EvidenceBundle build(RunContext context) {
                assertThat(context.hasOutput("a_out")).isTrue();
                return EvidenceBundle.empty();
            }
        });
        SkillDefinition skill = skill(StepDefinition.compute("a", "emit", "a_out", Map.of()));

        SkillRunResult result = runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.evidence()).isNotNull();
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void execute_evidenceBuilderFailure_isReportedButDoesNotFailRun() {
        evidenceBuilders.add(new SkillEvidenceBuilder() {
            @Override public String skillId() { return "s"; }
            @Override public EvidenceBundle build(RunContext context) { throw new IllegalStateException("bad shape"); }
        });
        SkillDefinition skill = skill(StepDefinition.compute("a", "emit", "a_out", Map.of()));

        SkillRunResult result = runtime(Runnable::run).execute(skill, RunRequest.onDemand("ws-1", Map.of()));

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.evidence()).isNull();
        assertThat(result.errors()).containsExactly("evidence: bad shape");
        verify(recorder).finished(any(), anyString(), any(), any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SkillRuntime runtime(Executor stepPool) {
        StepExecutor executor = new StepExecutor(new StepFunctionTable(functions), modelInvoker,
                new PromptRenderer(new ObjectMapper()), new ObjectMapper(), new SimpleMeterRegistry(),
                Runnable::run, Duration.ofSeconds(5));
        return new SkillRuntime(executor, new EvidenceBuilderRegistry(evidenceBuilders),
                ws -> Map.of(), recorder, new SimpleMeterRegistry(), stepPool, CLOCK);
    }

    private static SkillDefinition skill(StepDefinition... steps) {
        SkillDefinition.Builder b = SkillDefinition.builder("s");
        for (StepDefinition step : steps) b.step(step);
        return b.build();
    }

    interface Body {
        Object apply(Map<String, Object> args, RunContext ctx) throws Exception;
    }

    private StepFunction fn(String name, Body body) {
        return new StepFunction() {
            @Override public String name() { return name; }
            @Override public Object apply(Map<String, Object> args, RunContext ctx) throws Exception {
                calls.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
                return body.apply(args, ctx);
            }
        };
    }
}
