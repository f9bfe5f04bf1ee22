package com.pandora.orchestrator.skill;

import java.util.EnumSet;
import java.util.Set;

/**
 * When a skill runs without being asked to.
 *
 * @param cron     five- or six-field cron expression, or null
 * @param triggers events that start the skill; a non-null cron implies {@link ScheduleTrigger#CRON}
 */
public record SkillSchedule(String cron, Set<ScheduleTrigger> triggers) {

    public SkillSchedule {
        EnumSet<ScheduleTrigger> copy = EnumSet.noneOf(ScheduleTrigger.class);
        if (triggers != null) copy.addAll(triggers);
        if (cron != null && !cron.isBlank()) {
            copy.add(ScheduleTrigger.CRON);
        } else {
            cron = null;
        }
        triggers = Set.copyOf(copy);
    }

    public static SkillSchedule cron(String expression, ScheduleTrigger... extra) {
        return new SkillSchedule(expression, Set.of(extra));
    }

    public static SkillSchedule on(ScheduleTrigger first, ScheduleTrigger... rest) {
        EnumSet<ScheduleTrigger> set = EnumSet.of(first, rest);
        return new SkillSchedule(null, set);
    }

    public boolean hasTrigger(ScheduleTrigger trigger) {
        return triggers.contains(trigger);
    }

    public boolean isEmpty() {
        return cron == null && triggers.isEmpty();
    }
}
