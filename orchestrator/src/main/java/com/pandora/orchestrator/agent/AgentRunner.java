package com.pandora.orchestrator.agent;

import com.pandora.orchestrator.runtime.RunRequest;
import com.pandora.orchestrator.runtime.SkillNotFoundException;
import com.pandora.orchestrator.runtime.SkillRunResult;
import com.pandora.orchestrator.runtime.SkillRuntime;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an agent's skills one after another for a workspace. Each skill sees
 * the final outputs of the skills before it through its run's skill outputs.
 * A failing skill does not stop the ones after it.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final SkillRegistry skills;
    private final SkillRuntime  runtime;

    public AgentRunner(SkillRegistry skills, SkillRuntime runtime) {
        this.skills  = skills;
        this.runtime = runtime;
    }

    public List<SkillRunResult> run(AgentDefinition agent, String workspaceId) {
        log.info("Agent '{}' starting for workspace {} ({} skill(s))", agent.id(), workspaceId, agent.skillIds().size());
        Map<String, Object> skillOutputs = new LinkedHashMap<>();
        List<SkillRunResult> results = new ArrayList<>();
        for (String skillId : agent.skillIds()) {
            try {
                SkillDefinition skill = skills.get(skillId).orElseThrow(() -> new SkillNotFoundException(skillId));
                RunRequest request = new RunRequest(null, workspaceId, RunRequest.AGENT,
                        Map.of("agentId", agent.id()), null, null, skillOutputs);
                SkillRunResult result = runtime.execute(skill, request);
                results.add(result);
                if (result.finalOutput() != null) {
                    skillOutputs.put(skillId, result.finalOutput());
                }
            } catch (RuntimeException e) {
                log.error("Agent '{}' could not run skill '{}' for workspace {}: {}",
                        agent.id(), skillId, workspaceId, e.getMessage(), e);
            }
        }
        return results;
    }
}
