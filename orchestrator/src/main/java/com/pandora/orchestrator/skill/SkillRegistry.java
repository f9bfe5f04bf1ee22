package com.pandora.orchestrator.skill;

import java.util.List;

/**
 * Process-wide catalog of {@link SkillDefinition}s.
 *
 * <p>Constructed once by {@code RegistryConfig} and injected wherever skills
 * are looked up: the runtime, the post-sync trigger, the cron scheduler and
 * the REST layer. Tests build a fresh instance each.
 */
public class SkillRegistry extends DefinitionRegistry<SkillDefinition> {

    public SkillRegistry(DuplicatePolicy duplicatePolicy) {
        super("skill", duplicatePolicy);
    }

    /** Strict registry; the default for skills. */
    public SkillRegistry() {
        this(DuplicatePolicy.REJECT);
    }

    public List<SkillDefinition> listByCategory(SkillCategory category) {
        return list().stream()
                .filter(s -> s.category() == category)
                .toList();
    }

    /** Skills with a non-empty schedule (cron expression or at least one trigger). */
    public List<SkillDefinition> listScheduled() {
        return list().stream()
                .filter(SkillDefinition::isScheduled)
                .toList();
    }

    public List<SkillDefinition> listByTrigger(ScheduleTrigger trigger) {
        return list().stream()
                .filter(s -> s.hasTrigger(trigger))
                .toList();
    }
}
