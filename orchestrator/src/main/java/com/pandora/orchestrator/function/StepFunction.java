package com.pandora.orchestrator.function;

import com.pandora.orchestrator.runtime.RunContext;

import java.util.Map;

/**
 * A named compute function a COMPUTE step can reference through {@code computeFn}.
 *
 * <p>Implementations are Spring beans; {@link StepFunctionTable} collects them
 * at startup. The result should be JSON-shaped (maps, lists, scalars) so it
 * can be rendered into prompts and persisted with the run.
 */
public interface StepFunction {

    /** Name used by step definitions; unique across the table. */
    String name();

    /**
     * @param args merged arguments (earlier step outputs, the step's static
     *             args, run parameters and {@code workspaceId})
     * @throws Exception any failure; the executor wraps it as a step failure
     */
    Object apply(Map<String, Object> args, RunContext context) throws Exception;
}
