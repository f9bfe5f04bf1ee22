package com.pandora.orchestrator.runtime;

import java.util.Map;

/**
 * Read-only business context (sales cycle, targets, thresholds) for a workspace.
 * Model prompts and compute functions read it through {@link RunContext#businessContext()}.
 */
public interface BusinessContextProvider {

    Map<String, Object> contextFor(String workspaceId);
}
