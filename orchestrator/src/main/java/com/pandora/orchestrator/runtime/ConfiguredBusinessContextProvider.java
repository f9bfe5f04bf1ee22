package com.pandora.orchestrator.runtime;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves the same configured defaults to every workspace.
 *
 * Sections mirror the names skill prompts use:
 * {@code business_model}, {@code goals_and_targets}, {@code definitions}.
 */
@Component
public class ConfiguredBusinessContextProvider implements BusinessContextProvider {

    private final Map<String, Object> context;

    public ConfiguredBusinessContextProvider(
            @Value("${pandora.context.sales-cycle-days:90}") int salesCycleDays,
            @Value("${pandora.context.stale-deal-days:14}") int staleDealDays,
            @Value("${pandora.context.closing-soon-days:30}") int closingSoonDays,
            @Value("${pandora.context.pipeline-coverage-target:3.0}") double coverageTarget,
            @Value("${pandora.context.quarterly-quota:0}") double quarterlyQuota) {

        Map<String, Object> thresholds = new LinkedHashMap<>();
        thresholds.put("stale_deal_days", staleDealDays);
        thresholds.put("closing_soon_days", closingSoonDays);

        Map<String, Object> goals = new LinkedHashMap<>();
        goals.put("pipeline_coverage_target", coverageTarget);
        goals.put("quarterly_quota", quarterlyQuota);
        goals.put("thresholds", Map.copyOf(thresholds));

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("business_model", Map.of("sales_cycle_days", salesCycleDays));
        ctx.put("goals_and_targets", Map.copyOf(goals));
        ctx.put("definitions", Map.of("stale_deal", "no activity for " + staleDealDays + " days"));
        this.context = Map.copyOf(ctx);
    }

    @Override
    public Map<String, Object> contextFor(String workspaceId) {
        return context;
    }
}
