package com.pandora.orchestrator.skill;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A named, versioned analysis pipeline: an ordered list of steps plus the
 * metadata the registry, the schedulers and the runtime need.
 *
 * <p>Immutable once built. Steps are kept in declaration order; the runtime
 * derives the execution order from their dependencies.
 */
public record SkillDefinition(
        String               id,
        String               name,
        String               description,
        String               version,
        SkillCategory        category,
        ExecutionTier        tier,
        Set<String>          requiredTools,
        Set<String>          requiredContext,
        List<StepDefinition> steps,
        SkillSchedule        schedule,
        AnalysisWindow       analysisWindow,
        OutputFormat         outputFormat) implements RegistryEntry {

    public SkillDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Skill id is required");
        }
        if (name == null || name.isBlank()) name = id;
        if (version == null || version.isBlank()) version = "1.0.0";
        if (category == null) category = SkillCategory.OPERATIONS;
        if (tier == null) tier = ExecutionTier.COMPUTE;
        requiredTools   = requiredTools == null ? Set.of() : Set.copyOf(requiredTools);
        requiredContext = requiredContext == null ? Set.of() : Set.copyOf(requiredContext);
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (analysisWindow == null) analysisWindow = AnalysisWindow.CURRENT_QUARTER;
        if (outputFormat == null) outputFormat = OutputFormat.STRUCTURED;
    }

    public Optional<SkillSchedule> scheduleIfAny() {
        return schedule == null || schedule.isEmpty() ? Optional.empty() : Optional.of(schedule);
    }

    public boolean isScheduled() {
        return scheduleIfAny().isPresent();
    }

    public boolean hasTrigger(ScheduleTrigger trigger) {
        return schedule != null && schedule.hasTrigger(trigger);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String version;
        private SkillCategory category;
        private ExecutionTier tier;
        private final Set<String> requiredTools = new LinkedHashSet<>();
        private final Set<String> requiredContext = new LinkedHashSet<>();
        private final List<StepDefinition> steps = new ArrayList<>();
        private SkillSchedule schedule;
        private AnalysisWindow analysisWindow;
        private OutputFormat outputFormat;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String v)                  { this.name = v; return this; }
        public Builder description(String v)           { this.description = v; return this; }
        public Builder version(String v)               { this.version = v; return this; }
        public Builder category(SkillCategory v)       { this.category = v; return this; }
        public Builder tier(ExecutionTier v)           { this.tier = v; return this; }
        public Builder requiredTools(String... v)      { this.requiredTools.addAll(List.of(v)); return this; }
        public Builder requiredContext(String... v)    { this.requiredContext.addAll(List.of(v)); return this; }
        public Builder step(StepDefinition v)          { this.steps.add(v); return this; }
        public Builder schedule(SkillSchedule v)       { this.schedule = v; return this; }
        public Builder analysisWindow(AnalysisWindow v) { this.analysisWindow = v; return this; }
        public Builder outputFormat(OutputFormat v)    { this.outputFormat = v; return this; }

        public SkillDefinition build() {
            return new SkillDefinition(id, name, description, version, category, tier,
                    requiredTools, requiredContext, steps, schedule, analysisWindow, outputFormat);
        }
    }
}
