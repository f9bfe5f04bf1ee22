package com.pandora.orchestrator.skill;

/**
 * What a {@link DefinitionRegistry} does when an id is registered twice.
 *
 * REJECT: throw {@link DuplicateDefinitionException}; used for skills, whose
 *           ids are referenced by persisted runs and must never silently change.
 * REPLACE: log a warning and overwrite; used for agent definitions, which are
 *           reloaded while the process is running.
 */
public enum DuplicatePolicy {
    REJECT,
    REPLACE
}
