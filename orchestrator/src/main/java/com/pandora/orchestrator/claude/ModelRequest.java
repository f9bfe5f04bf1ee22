package com.pandora.orchestrator.claude;

import com.pandora.orchestrator.skill.ModelStepDescriptor.Capability;

/**
 * One model call issued by a MODEL step.
 *
 * @param systemPrompt may be null
 * @param jsonOutput   the caller will parse the answer as JSON
 */
public record ModelRequest(
        String     workspaceId,
        String     skillId,
        String     stepId,
        Capability capability,
        String     systemPrompt,
        String     prompt,
        int        maxTokens,
        boolean    jsonOutput) {}
