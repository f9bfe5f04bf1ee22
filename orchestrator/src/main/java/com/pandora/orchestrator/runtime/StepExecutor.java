package com.pandora.orchestrator.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.claude.ModelInvoker;
import com.pandora.orchestrator.claude.ModelRequest;
import com.pandora.orchestrator.claude.ModelResponse;
import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.function.StepFunctionTable;
import com.pandora.orchestrator.function.UnknownFunctionException;
import com.pandora.orchestrator.skill.ModelStepDescriptor;
import com.pandora.orchestrator.skill.StepDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single step. Knows nothing about ordering: the runtime calls it once
 * the step's dependencies have published their outputs.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   pandora.skill.step.calls{skill, tier, status="success|function_error|model_error|timeout|parse_error|unknown_function"}
 *   pandora.skill.step.duration{skill, tier}
 * </pre>
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    static final String SYSTEM_PROMPT =
            "You are a revenue operations analyst. Answer only from the data provided.";
    static final String JSON_INSTRUCTION =
            "\n\nRespond with valid JSON only, no prose and no code fences.";

    /** Output of one successful step. */
    public record StepResult(Object output, long tokensUsed) {}

    private final StepFunctionTable functions;
    private final ModelInvoker      modelInvoker;
    private final PromptRenderer    promptRenderer;
    private final ObjectMapper      json;
    private final MeterRegistry     meterRegistry;
    private final Executor          modelCallExecutor;
    private final Duration          defaultModelTimeout;

    public StepExecutor(StepFunctionTable functions,
                        ModelInvoker modelInvoker,
                        PromptRenderer promptRenderer,
                        ObjectMapper objectMapper,
                        MeterRegistry meterRegistry,
                        @Qualifier("modelCallExecutor") Executor modelCallExecutor,
                        @Value("${pandora.skills.model-step-timeout:PT2M}") Duration defaultModelTimeout) {
        this.functions           = functions;
        this.modelInvoker        = modelInvoker;
        this.promptRenderer      = promptRenderer;
        this.json                = objectMapper;
        this.meterRegistry       = meterRegistry;
        this.modelCallExecutor   = modelCallExecutor;
        this.defaultModelTimeout = defaultModelTimeout;
    }

    /**
     * @param runParams caller parameters of the run, merged over the step's static args
     * @throws StepExecutionException   when the function or model call fails
     * @throws UnknownFunctionException when {@code computeFn} is not registered
     */
    public StepResult execute(StepDefinition step, RunContext ctx, Map<String, Object> runParams) {
        String tierTag = step.tier().name().toLowerCase(Locale.ROOT);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return switch (step.tier()) {
                case COMPUTE -> runCompute(step, ctx, runParams);
                case MODEL   -> runModel(step, ctx, runParams);
            };
        } catch (StepExecutionException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (UnknownFunctionException e) {
            status = "unknown_function";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("pandora.skill.step.duration",
                    "skill", ctx.skillId(), "tier", tierTag));
            meterRegistry.counter("pandora.skill.step.calls",
                    "skill", ctx.skillId(), "tier", tierTag, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Compute tier
    // ------------------------------------------------------------------

    private StepResult runCompute(StepDefinition step, RunContext ctx, Map<String, Object> runParams) {
        StepFunction fn = functions.resolve(step.computeFn());
        Map<String, Object> args = mergeArgs(step, ctx, runParams);
        try {
            return new StepResult(fn.apply(args, ctx), 0);
        } catch (StepExecutionException e) {
            throw e;
        } catch (Exception e) {
            throw new StepExecutionException(step.id(), StepExecutionException.Kind.FUNCTION_ERROR,
                    fn.name() + " failed: " + e.getMessage(), e);
        }
    }

    /** Shallow merge: step outputs, then static args, then run params, then workspaceId. */
    static Map<String, Object> mergeArgs(StepDefinition step, RunContext ctx, Map<String, Object> runParams) {
        Map<String, Object> args = new HashMap<>(ctx.stepOutputs());
        args.putAll(step.computeArgs());
        if (runParams != null) args.putAll(runParams);
        args.put("workspaceId", ctx.workspaceId());
        return args;
    }

    // ------------------------------------------------------------------
    // Model tier
    // ------------------------------------------------------------------

    private StepResult runModel(StepDefinition step, RunContext ctx, Map<String, Object> runParams) {
        ModelStepDescriptor descriptor = step.model();
        String prompt = promptRenderer.render(descriptor.promptTemplate(),
                mergeArgs(step, ctx, runParams), ctx.businessContext());
        if (descriptor.expectsJson()) {
            prompt = prompt + JSON_INSTRUCTION;
        }
        ModelRequest request = new ModelRequest(ctx.workspaceId(), ctx.skillId(), step.id(),
                descriptor.capability(), SYSTEM_PROMPT, prompt, descriptor.maxTokens(), descriptor.expectsJson());

        Duration timeout = descriptor.timeout() != null ? descriptor.timeout() : defaultModelTimeout;
        ModelResponse response = callWithTimeout(step.id(), request, timeout);

        Object output = descriptor.expectsJson()
                ? parseJson(step.id(), ctx, response.text())
                : response.text();
        return new StepResult(output, response.totalTokens());
    }

    private ModelResponse callWithTimeout(String stepId, ModelRequest request, Duration timeout) {
        CompletableFuture<ModelResponse> call =
                CompletableFuture.supplyAsync(() -> modelInvoker.invoke(request), modelCallExecutor);
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new StepExecutionException(stepId, StepExecutionException.Kind.TIMEOUT,
                    "model call exceeded " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new StepExecutionException(stepId, StepExecutionException.Kind.MODEL_ERROR,
                    cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new StepExecutionException(stepId, StepExecutionException.Kind.MODEL_ERROR,
                    "interrupted while waiting for the model", e);
        }
    }

    /**
     * Parse a JSON answer. A blank answer is a parse error; anything else that
     * is not valid JSON is kept as raw text.
     */
    Object parseJson(String stepId, RunContext ctx, String text) {
        if (text == null || text.isBlank()) {
            throw new StepExecutionException(stepId, StepExecutionException.Kind.PARSE_ERROR,
                    "model returned an empty answer where JSON was expected");
        }
        String candidate = stripFences(text);
        try {
            return json.readValue(candidate, Object.class);
        } catch (JsonProcessingException e) {
            log.warn("Step '{}' of skill '{}' (run {}, workspace {}) returned invalid JSON; keeping raw text: {}",
                    stepId, ctx.skillId(), ctx.runId(), ctx.workspaceId(), e.getOriginalMessage());
            return text;
        }
    }

    static String stripFences(String text) {
        String t = text.trim();
        if (t.startsWith("```")) {
            int firstNewline = t.indexOf('\n');
            int lastFence = t.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                t = t.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return t;
    }
}
