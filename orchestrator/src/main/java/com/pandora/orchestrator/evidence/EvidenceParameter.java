package com.pandora.orchestrator.evidence;

/**
 * A threshold or assumption the skill used, shown so readers can see why a
 * record was flagged.
 *
 * @param configurable whether the workspace may change it in its settings
 */
public record EvidenceParameter(
        String  name,
        String  displayName,
        Object  value,
        String  description,
        boolean configurable) {

    public EvidenceParameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name is required");
        }
        if (displayName == null) displayName = name;
        if (description == null) description = "";
    }
}
