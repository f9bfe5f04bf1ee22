package com.pandora.orchestrator.library;

import com.pandora.orchestrator.agent.AgentDefinition;
import com.pandora.orchestrator.skill.SkillDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Built-in skills and agents. {@code RegistryConfig} collects every
 * {@link SkillDefinition} and {@link AgentDefinition} bean.
 */
@Configuration
public class SkillLibraryConfig {

    @Bean
    public SkillDefinition pipelineHygieneSkill() {
        return PipelineHygieneSkill.definition();
    }

    @Bean
    public AgentDefinition weeklyPipelineBriefingAgent() {
        return PipelineHygieneSkill.weeklyBriefing();
    }
}
