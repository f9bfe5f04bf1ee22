package com.pandora.orchestrator.api.dto;

import com.pandora.orchestrator.skill.ScheduleTrigger;
import com.pandora.orchestrator.skill.SkillDefinition;

import java.util.List;

/** One entry of GET /skills. */
public record SkillSummaryResponse(
        String       id,
        String       name,
        String       description,
        String       version,
        String       category,
        String       tier,
        int          steps,
        String       cron,
        List<String> triggers
) {
    public static SkillSummaryResponse from(SkillDefinition skill) {
        return new SkillSummaryResponse(
                skill.id(),
                skill.name(),
                skill.description(),
                skill.version(),
                skill.category().name(),
                skill.tier().name(),
                skill.steps().size(),
                skill.scheduleIfAny().map(s -> s.cron()).orElse(null),
                skill.scheduleIfAny()
                        .map(s -> s.triggers().stream().map(ScheduleTrigger::name).sorted().toList())
                        .orElse(List.of())
        );
    }
}
