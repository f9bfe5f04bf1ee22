package com.pandora.orchestrator.library;

import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.model.Deal;
import com.pandora.orchestrator.repository.DealRepository;
import com.pandora.orchestrator.runtime.RunContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Open pipeline totals, per-stage breakdown and coverage against quota.
 * {@code coverageRatio} is null when no quota is configured.
 */
@Component
public class PipelineCoverageFunction implements StepFunction {

    private final DealRepository deals;

    public PipelineCoverageFunction(DealRepository deals) {
        this.deals = deals;
    }

    @Override
    public String name() { return "computePipelineCoverage"; }

    @Override
    public Object apply(Map<String, Object> args, RunContext ctx) {
        List<Deal> open = deals.findByWorkspaceIdAndClosedFalse(ctx.workspaceId());

        BigDecimal total = BigDecimal.ZERO;
        Map<String, Map<String, Object>> byStage = new TreeMap<>();
        for (Deal deal : open) {
            BigDecimal amount = DealViews.amountOf(deal);
            total = total.add(amount);
            String stage = deal.getStage() == null ? "unknown" : deal.getStage();
            Map<String, Object> bucket = byStage.computeIfAbsent(stage, k -> {
                Map<String, Object> b = new LinkedHashMap<>();
                b.put("count", 0);
                b.put("value", 0.0);
                return b;
            });
            bucket.put("count", (Integer) bucket.get("count") + 1);
            bucket.put("value", (Double) bucket.get("value") + amount.doubleValue());
        }

        double quota  = ctx.contextValue("goals_and_targets.quarterly_quota")
                .map(v -> ((Number) v).doubleValue()).orElse(0.0);
        double target = ctx.contextValue("goals_and_targets.pipeline_coverage_target")
                .map(v -> ((Number) v).doubleValue()).orElse(3.0);
        Double ratio = quota > 0 ? total.doubleValue() / quota : null;

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("openDeals",      open.size());
        out.put("totalPipeline",  total.doubleValue());
        out.put("quota",          quota);
        out.put("coverageTarget", target);
        out.put("coverageRatio",  ratio);
        out.put("coverageGap",    ratio != null && ratio < target);
        out.put("byStage",        byStage);
        return out;
    }
}
