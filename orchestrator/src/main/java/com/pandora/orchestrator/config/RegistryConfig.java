package com.pandora.orchestrator.config;

import com.pandora.orchestrator.agent.AgentDefinition;
import com.pandora.orchestrator.agent.AgentRegistry;
import com.pandora.orchestrator.skill.DuplicatePolicy;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the skill and agent registries from every definition bean in the context.
 *
 * Skills reject a second definition with the same id by default; agents are
 * regenerated from skills and replace the earlier entry.
 */
@Configuration
public class RegistryConfig {

    @Bean
    public SkillRegistry skillRegistry(List<SkillDefinition> skills,
                                       @Value("${pandora.registry.skill-duplicates:REJECT}") DuplicatePolicy policy) {
        SkillRegistry registry = new SkillRegistry(policy);
        registry.registerAll(skills);
        return registry;
    }

    @Bean
    public AgentRegistry agentRegistry(List<AgentDefinition> agents,
                                       @Value("${pandora.registry.agent-duplicates:REPLACE}") DuplicatePolicy policy) {
        AgentRegistry registry = new AgentRegistry(policy);
        registry.registerAll(agents);
        return registry;
    }
}
