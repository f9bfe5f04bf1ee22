package com.pandora.orchestrator.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.claude.ModelInvocationException;
import com.pandora.orchestrator.claude.ModelInvoker;
import com.pandora.orchestrator.claude.ModelRequest;
import com.pandora.orchestrator.claude.ModelResponse;
import com.pandora.orchestrator.function.StepFunctionTable;
import com.pandora.orchestrator.skill.AnalysisWindow;
import com.pandora.orchestrator.skill.ExecutionTier;
import com.pandora.orchestrator.skill.ModelStepDescriptor;
import com.pandora.orchestrator.skill.StepDefinition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StepExecutorTest {

    @Mock ModelInvoker modelInvoker;

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private ExecutorService modelPool;
    private StepExecutor executor;
    private RunContext ctx;

    @BeforeEach
    void setUp() {
        modelPool = Executors.newSingleThreadExecutor();
        executor = new StepExecutor(new StepFunctionTable(List.of()), modelInvoker,
                new PromptRenderer(new ObjectMapper()), new ObjectMapper(), meters, modelPool, Duration.ofSeconds(5));
        ctx = new RunContext("run-1", "pipeline-hygiene", "ws-1",
                TimeWindows.resolve(AnalysisWindow.CURRENT_QUARTER, Instant.parse("2026-03-04T10:00:00Z")),
                Map.of("goals_and_targets", Map.of("pipeline_coverage_target", 3.0)), Map.of(), Map.of());
        ctx.recordOutput("stale_deals_agg", Map.of("summary", Map.of("total", 4)));
    }

    @AfterEach
    void tearDown() {
        modelPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Model tier
    // ------------------------------------------------------------------

    @Test
    void modelStep_rendersPromptAndParsesJson() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("[{\"dealId\":\"d1\"}]", 100, 20));

        StepExecutor.StepResult result = executor.execute(classifyStep(), ctx, Map.of());

        assertThat(result.output()).isEqualTo(List.of(Map.of("dealId", "d1")));
        assertThat(result.tokensUsed()).isEqualTo(120);

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelInvoker).invoke(captor.capture());
        assertThat(captor.getValue().prompt())
                .contains("Stale: 4")
                .contains("Target: 3.0")
                .endsWith(StepExecutor.JSON_INSTRUCTION);
        assertThat(captor.getValue().jsonOutput()).isTrue();
    }

    @Test
    void modelStep_fencedJson_isUnwrapped() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("```json\n{\"ok\": true}\n```", 1, 1));

        assertThat(executor.execute(classifyStep(), ctx, Map.of()).output()).isEqualTo(Map.of("ok", true));
    }

    @Test
    void modelStep_invalidJson_fallsBackToRawText() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("Sorry, here is prose instead.", 10, 5));

        StepExecutor.StepResult result = executor.execute(classifyStep(), ctx, Map.of());

        assertThat(result.output()).isEqualTo("Sorry, here is prose instead.");
    }

    @Test
    void modelStep_blankAnswer_isParseError() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("  ", 10, 0));

        assertThatThrownBy(() -> executor.execute(classifyStep(), ctx, Map.of()))
                .isInstanceOf(StepExecutionException.class)
                .extracting(e -> ((StepExecutionException) e).getKind())
                .isEqualTo(StepExecutionException.Kind.PARSE_ERROR);
    }

    @Test
    void modelStep_slowModel_timesOut() {
        when(modelInvoker.invoke(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return new ModelResponse("[]", 1, 1);
        });
        ModelStepDescriptor quick = new ModelStepDescriptor(ModelStepDescriptor.Capability.CLASSIFY,
                "Classify {{stale_deals_agg}}", Map.of("type", "array"), 256, Duration.ofMillis(100));
        StepDefinition step = StepDefinition.model("classify", quick, "classes");

        assertThatThrownBy(() -> executor.execute(step, ctx, Map.of()))
                .isInstanceOf(StepExecutionException.class)
                .extracting(e -> ((StepExecutionException) e).getKind())
                .isEqualTo(StepExecutionException.Kind.TIMEOUT);
        assertThat(meters.counter("pandora.skill.step.calls",
                "skill", "pipeline-hygiene", "tier", "model", "status", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void modelStep_invokerError_isModelError() {
        when(modelInvoker.invoke(any())).thenThrow(new ModelInvocationException(529, "overloaded"));

        assertThatThrownBy(() -> executor.execute(classifyStep(), ctx, Map.of()))
                .isInstanceOf(StepExecutionException.class)
                .extracting(e -> ((StepExecutionException) e).getKind())
                .isEqualTo(StepExecutionException.Kind.MODEL_ERROR);
    }

    @Test
    void reasonStep_returnsTextUnparsed() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("{not parsed}", 3, 4));
        StepDefinition step = StepDefinition.model("summarise",
                ModelStepDescriptor.reason("Summarise {{stale_deals_agg.summary}}"), "summary");

        assertThat(executor.execute(step, ctx, Map.of()).output()).isEqualTo("{not parsed}");
    }

    @Test
    void modelStep_promptSeesStaticArgsRunParamsAndWorkspace() {
        when(modelInvoker.invoke(any())).thenReturn(new ModelResponse("ok", 1, 1));
        StepDefinition step = new StepDefinition("brief", "brief", ExecutionTier.MODEL, null,
                ModelStepDescriptor.reason("focus={{focus}} region={{region}} ws={{workspaceId}}"),
                Map.of("focus", "enterprise"), Set.of(), "brief");

        executor.execute(step, ctx, Map.of("region", "EMEA"));

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelInvoker).invoke(captor.capture());
        assertThat(captor.getValue().prompt()).isEqualTo("focus=enterprise region=EMEA ws=ws-1");
    }

    // ------------------------------------------------------------------
    // Argument merge
    // ------------------------------------------------------------------

    @Test
    void mergeArgs_paramsBeatStaticArgsBeatOutputs_workspaceIdAlwaysWins() {
        ctx.recordOutput("topN", "from-output");
        StepDefinition step = StepDefinition.compute("agg", "fn", "agg_out",
                Map.of("topN", 20, "staleDays", 14, "workspaceId", "spoofed"));

        Map<String, Object> args = StepExecutor.mergeArgs(step, ctx, Map.of("staleDays", 30));

        assertThat(args)
                .containsEntry("topN", 20)
                .containsEntry("staleDays", 30)
                .containsEntry("workspaceId", "ws-1")
                .containsKey("stale_deals_agg");
    }

    @Test
    void stripFences_leavesPlainTextAlone() {
        assertThat(StepExecutor.stripFences("  {\"a\":1} ")).isEqualTo("{\"a\":1}");
        assertThat(StepExecutor.stripFences("```\n[1]\n```")).isEqualTo("[1]");
    }

    private static StepDefinition classifyStep() {
        return StepDefinition.model("classify",
                ModelStepDescriptor.classify(
                        "Stale: {{stale_deals_agg.summary.total}} Target: {{goals_and_targets.pipeline_coverage_target}}",
                        Map.of("type", "array")),
                "classes");
    }
}
