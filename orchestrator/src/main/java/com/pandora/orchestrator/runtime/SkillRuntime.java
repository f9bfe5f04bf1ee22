package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.evidence.EvidenceBuilderRegistry;
import com.pandora.orchestrator.evidence.EvidenceBundle;
import com.pandora.orchestrator.evidence.SkillEvidenceBuilder;
import com.pandora.orchestrator.function.UnknownFunctionException;
import com.pandora.orchestrator.skill.AnalysisWindow;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.StepDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Executes a skill's step graph.
 *
 * <p>Each step gets exactly one future, chained on the futures of its
 * dependencies, so a step starts only after every dependency has published
 * its output. Independent branches may run in parallel when the step executor
 * pool allows it; with the default direct executor steps run one at a time in
 * declaration order.
 *
 * <p>A failed step fails only itself: its transitive dependents are marked
 * SKIPPED and every other step still runs. The run is FAILED if any step
 * failed. Step futures never complete exceptionally; every path yields a
 * {@link StepOutcome}.
 */
@Service
public class SkillRuntime {

    private static final Logger log = LoggerFactory.getLogger(SkillRuntime.class);

    private final StepExecutor            stepExecutor;
    private final EvidenceBuilderRegistry evidenceBuilders;
    private final BusinessContextProvider contextProvider;
    private final SkillRunRecorder        recorder;
    private final MeterRegistry           meterRegistry;
    private final Executor                stepPool;
    private final Clock                   clock;

    public SkillRuntime(StepExecutor stepExecutor,
                        EvidenceBuilderRegistry evidenceBuilders,
                        BusinessContextProvider contextProvider,
                        SkillRunRecorder recorder,
                        MeterRegistry meterRegistry,
                        @Qualifier("skillStepExecutor") Executor stepPool,
                        Clock clock) {
        this.stepExecutor     = stepExecutor;
        this.evidenceBuilders = evidenceBuilders;
        this.contextProvider  = contextProvider;
        this.recorder         = recorder;
        this.meterRegistry    = meterRegistry;
        this.stepPool         = stepPool;
        this.clock            = clock;
    }

    /**
     * Run every step of {@code skill} for one workspace.
     *
     * @throws InvalidGraphException if the step graph is malformed; nothing has run
     */
    public SkillRunResult execute(SkillDefinition skill, RunRequest request) {
        StepGraph graph = StepGraph.of(skill);

        Instant started = clock.instant();
        AnalysisWindow window = request.windowOverride() != null ? request.windowOverride() : skill.analysisWindow();
        RunContext ctx = new RunContext(request.runId(), skill.id(), request.workspaceId(),
                TimeWindows.resolve(window, started),
                contextProvider.contextFor(request.workspaceId()),
                request.payload(), request.skillOutputs());

        log.info("Skill '{}' run {} started for workspace {} (trigger={}, steps={})",
                skill.id(), ctx.runId(), ctx.workspaceId(), request.trigger(), graph.size());
        recorder.started(ctx, request.trigger(), started);

        AtomicLong tokens = new AtomicLong();
        Map<String, CompletableFuture<StepOutcome>> futures = new LinkedHashMap<>();
        for (StepDefinition step : graph.steps()) {
            // dependencies are declared earlier, so their futures already exist
            Map<String, CompletableFuture<StepOutcome>> upstream = new LinkedHashMap<>();
            step.dependsOn().forEach(dep -> upstream.put(dep, futures.get(dep)));

            CompletableFuture<StepOutcome> future = CompletableFuture
                    .allOf(upstream.values().toArray(new CompletableFuture<?>[0]))
                    .thenApplyAsync(ignored -> runStep(step, upstream, ctx, request.params(), tokens), stepPool);
            futures.put(step.id(), future);
        }

        Map<String, StepOutcome> outcomes = new LinkedHashMap<>();
        futures.forEach((id, f) -> outcomes.put(id, f.join()));

        List<String> errors = new ArrayList<>();
        outcomes.values().stream()
                .filter(o -> o.status() == StepStatus.FAILED)
                .forEach(o -> errors.add(o.stepId() + ": " + o.error()));
        RunStatus status = errors.isEmpty() ? RunStatus.COMPLETED : RunStatus.FAILED;

        EvidenceBundle evidence = buildEvidence(ctx, errors);

        List<StepDefinition> steps = graph.steps();
        Object finalOutput = steps.isEmpty()
                ? null
                : ctx.output(steps.get(steps.size() - 1).outputKey()).orElse(null);

        Instant finished = clock.instant();
        SkillRunResult result = new SkillRunResult(ctx.runId(), skill.id(), ctx.workspaceId(), status,
                orderedOutputs(steps, ctx), outcomes, evidence, Duration.between(started, finished),
                tokens.get(), errors, finalOutput);

        meterRegistry.counter("pandora.skill.runs",
                "skill", skill.id(), "status", status.name().toLowerCase(Locale.ROOT)).increment();
        log.info("Skill '{}' run {} {} for workspace {} ({} completed, {} failed, {} skipped, {} tokens)",
                skill.id(), ctx.runId(), status, ctx.workspaceId(),
                result.count(StepStatus.COMPLETED), result.count(StepStatus.FAILED),
                result.count(StepStatus.SKIPPED), result.tokenUsage());
        recorder.finished(result, request.trigger(), started, finished);
        return result;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Outputs keyed in step declaration order; steps that produced nothing are absent. */
    private static Map<String, Object> orderedOutputs(List<StepDefinition> steps, RunContext ctx) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            ctx.output(step.outputKey()).ifPresent(value -> ordered.put(step.outputKey(), value));
        }
        return ordered;
    }

    private StepOutcome runStep(StepDefinition step,
                                Map<String, CompletableFuture<StepOutcome>> upstream,
                                RunContext ctx,
                                Map<String, Object> params,
                                AtomicLong tokens) {
        for (Map.Entry<String, CompletableFuture<StepOutcome>> dep : upstream.entrySet()) {
            StepOutcome depOutcome = dep.getValue().join();
            if (!depOutcome.isCompleted()) {
                String reason = "upstream step '" + dep.getKey() + "' " + depOutcome.status().name().toLowerCase(Locale.ROOT);
                log.info("Skipping step '{}' of skill '{}' run {}: {}", step.id(), ctx.skillId(), ctx.runId(), reason);
                return StepOutcome.skipped(step.id(), step.outputKey(), reason);
            }
        }

        long t0 = System.nanoTime();
        try {
            StepExecutor.StepResult r = stepExecutor.execute(step, ctx, params);
            ctx.recordOutput(step.outputKey(), r.output());
            tokens.addAndGet(r.tokensUsed());
            Duration took = Duration.ofNanos(System.nanoTime() - t0);
            log.debug("Step '{}' of skill '{}' run {} completed in {} ms",
                    step.id(), ctx.skillId(), ctx.runId(), took.toMillis());
            return StepOutcome.completed(step.id(), step.outputKey(), took, r.tokensUsed());
        } catch (StepExecutionException e) {
            return failed(step, ctx, t0, e.getKind().name(), e.getMessage(), e);
        } catch (UnknownFunctionException e) {
            return failed(step, ctx, t0, "UNKNOWN_FUNCTION", e.getMessage(), e);
        } catch (RuntimeException e) {
            return failed(step, ctx, t0, StepExecutionException.Kind.FUNCTION_ERROR.name(), e.getMessage(), e);
        }
    }

    private static StepOutcome failed(StepDefinition step, RunContext ctx, long t0,
                                      String type, String message, Exception cause) {
        log.warn("Step '{}' of skill '{}' run {} failed for workspace {}: {}",
                step.id(), ctx.skillId(), ctx.runId(), ctx.workspaceId(), message, cause);
        return StepOutcome.failed(step.id(), step.outputKey(),
                Duration.ofNanos(System.nanoTime() - t0), type, message);
    }

    private EvidenceBundle buildEvidence(RunContext ctx, List<String> errors) {
        Optional<SkillEvidenceBuilder> builder = evidenceBuilders.find(ctx.skillId());
        if (builder.isEmpty()) {
            return null;
        }
        try {
            return builder.get().build(ctx);
        } catch (RuntimeException e) {
            log.error("Evidence builder for skill '{}' failed in run {} (workspace {})",
                    ctx.skillId(), ctx.runId(), ctx.workspaceId(), e);
            errors.add("evidence: " + e.getMessage());
            return null;
        }
    }
}
