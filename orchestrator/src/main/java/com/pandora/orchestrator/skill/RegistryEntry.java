package com.pandora.orchestrator.skill;

/**
 * Anything that can be held by a {@link DefinitionRegistry}: a stable,
 * process-unique identifier is all the registry needs.
 */
public interface RegistryEntry {

    String id();
}
