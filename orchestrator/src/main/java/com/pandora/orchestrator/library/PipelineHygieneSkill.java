package com.pandora.orchestrator.library;

import com.pandora.orchestrator.agent.AgentDefinition;
import com.pandora.orchestrator.skill.AnalysisWindow;
import com.pandora.orchestrator.skill.ExecutionTier;
import com.pandora.orchestrator.skill.ModelStepDescriptor;
import com.pandora.orchestrator.skill.OutputFormat;
import com.pandora.orchestrator.skill.ScheduleTrigger;
import com.pandora.orchestrator.skill.SkillCategory;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.SkillSchedule;
import com.pandora.orchestrator.skill.StepDefinition;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in pipeline hygiene skill: stale deals, deals closing soon, coverage
 * against quota, and a model pass that classifies the root cause per deal.
 */
public final class PipelineHygieneSkill {

    public static final String ID       = "pipeline-hygiene";
    public static final String AGENT_ID = "weekly-pipeline-briefing";

    static final String STALE_KEY           = "stale_deals_agg";
    static final String CLOSING_KEY         = "closing_soon_agg";
    static final String SUMMARY_KEY         = "pipeline_summary";
    static final String CLASSIFICATIONS_KEY = "deal_classifications";

    static final String CLASSIFY_PROMPT = """
            You are a RevOps data analyst. Classify each deal below to identify the root cause and recommend one action.

            root_cause is one of: rep_neglect, prospect_stalled, data_hygiene, process_gap, timing, competitive_loss, champion_change.

            Context:
            - Stale threshold: {{goals_and_targets.thresholds.stale_deal_days}} days
            - Average sales cycle: {{business_model.sales_cycle_days}} days
            - Pipeline coverage target: {{goals_and_targets.pipeline_coverage_target}}x

            STALE DEALS (top 20 by amount):
            {{stale_deals_agg.topDeals}}

            DEALS CLOSING IN 30 DAYS (top 10 by amount):
            {{closing_soon_agg.topDeals}}

            Return a JSON array with one object per deal:
            {"dealId": "...", "dealName": "...", "category": "stale" | "closing_soon",
             "root_cause": "...", "confidence": 0.0-1.0, "signals": ["..."], "suggested_action": "..."}
            """;

    static final Map<String, Object> CLASSIFY_SCHEMA = Map.of(
            "type", "array",
            "items", Map.of(
                    "type", "object",
                    "required", List.of("dealName", "root_cause", "confidence", "suggested_action"),
                    "properties", Map.of(
                            "dealId",           Map.of("type", "string"),
                            "dealName",         Map.of("type", "string"),
                            "category",         Map.of("type", "string", "enum", List.of("stale", "closing_soon")),
                            "root_cause",       Map.of("type", "string"),
                            "confidence",       Map.of("type", "number"),
                            "signals",          Map.of("type", "array", "items", Map.of("type", "string")),
                            "suggested_action", Map.of("type", "string"))));

    private PipelineHygieneSkill() {}

    public static SkillDefinition definition() {
        return SkillDefinition.builder(ID)
                .name("Pipeline Hygiene Check")
                .description("Flags stale deals, deals closing soon and pipeline coverage gaps, "
                        + "with a root cause and next step per flagged deal.")
                .version("2.2.0")
                .category(SkillCategory.PIPELINE)
                .tier(ExecutionTier.MODEL)
                .requiredTools("resolveTimeWindows", "computePipelineCoverage",
                        "aggregateStaleDeals", "aggregateClosingSoon")
                .requiredContext("business_model", "goals_and_targets", "definitions")
                .step(StepDefinition.compute("resolve-time-windows", "resolveTimeWindows", "time_windows",
                        Map.of("analysisWindow", "current_quarter")).named("Resolve Time Windows"))
                .step(StepDefinition.compute("gather-pipeline-summary", "computePipelineCoverage", SUMMARY_KEY,
                        Map.of(), "resolve-time-windows").named("Pipeline Summary"))
                .step(StepDefinition.compute("aggregate-stale-deals", "aggregateStaleDeals", STALE_KEY,
                        Map.of("topN", 20)).named("Aggregate Stale Deals"))
                .step(StepDefinition.compute("aggregate-closing-soon", "aggregateClosingSoon", CLOSING_KEY,
                        Map.of("daysAhead", 30, "topN", 10)).named("Aggregate Deals Closing Soon"))
                .step(StepDefinition.model("classify-deals",
                        ModelStepDescriptor.classify(CLASSIFY_PROMPT, CLASSIFY_SCHEMA), CLASSIFICATIONS_KEY,
                        "aggregate-stale-deals", "aggregate-closing-soon").named("Classify Deal Issues"))
                .schedule(SkillSchedule.on(ScheduleTrigger.ON_DEMAND, ScheduleTrigger.POST_SYNC))
                .analysisWindow(AnalysisWindow.CURRENT_QUARTER)
                .outputFormat(OutputFormat.SLACK)
                .build();
    }

    /** Runs the hygiene check every Monday at 08:00 UTC. */
    public static AgentDefinition weeklyBriefing() {
        return new AgentDefinition(AGENT_ID, "Weekly Pipeline Briefing", List.of(ID),
                SkillSchedule.cron("0 8 * * 1"), Set.of(), true);
    }
}
