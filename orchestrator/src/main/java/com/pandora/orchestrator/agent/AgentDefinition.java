package com.pandora.orchestrator.agent;

import com.pandora.orchestrator.skill.RegistryEntry;
import com.pandora.orchestrator.skill.SkillSchedule;

import java.util.List;
import java.util.Set;

/**
 * A bundle of skills run together for a set of workspaces.
 *
 * <p>Agents are derived from skills and may be reloaded while the process
 * runs; {@code enabled} is the only field that changes after registration
 * (see {@link AgentRegistry#setEnabled}).
 *
 * @param workspaceIds workspaces the agent runs for; empty means all workspaces
 */
public record AgentDefinition(
        String        id,
        String        name,
        List<String>  skillIds,
        SkillSchedule schedule,
        Set<String>   workspaceIds,
        boolean       enabled) implements RegistryEntry {

    public AgentDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (name == null || name.isBlank()) name = id;
        skillIds = skillIds == null ? List.of() : List.copyOf(skillIds);
        workspaceIds = workspaceIds == null ? Set.of() : Set.copyOf(workspaceIds);
    }

    public boolean appliesTo(String workspaceId) {
        return workspaceIds.isEmpty() || workspaceIds.contains(workspaceId);
    }

    public AgentDefinition withEnabled(boolean flag) {
        return new AgentDefinition(id, name, skillIds, schedule, workspaceIds, flag);
    }
}
