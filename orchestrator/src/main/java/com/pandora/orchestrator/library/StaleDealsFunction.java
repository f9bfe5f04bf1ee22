package com.pandora.orchestrator.library;

import com.pandora.orchestrator.evidence.Severity;
import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.model.Deal;
import com.pandora.orchestrator.repository.DealRepository;
import com.pandora.orchestrator.runtime.RunContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open deals with no activity for at least the stale threshold. A deal idle for
 * one and a half times the threshold is critical, otherwise warning.
 *
 * Args: {@code staleDays} (default from business context), {@code topN}.
 */
@Component
public class StaleDealsFunction implements StepFunction {

    private final DealRepository deals;
    private final Clock clock;

    public StaleDealsFunction(DealRepository deals, Clock clock) {
        this.deals = deals;
        this.clock = clock;
    }

    @Override
    public String name() { return "aggregateStaleDeals"; }

    @Override
    public Object apply(Map<String, Object> args, RunContext ctx) {
        int staleDays = DealViews.intArg(args, "staleDays", ctx,
                "goals_and_targets.thresholds.stale_deal_days", DealViews.DEFAULT_STALE_DAYS);
        int topN = DealViews.intArg(args, "topN", ctx, null, 20);
        Instant now = clock.instant();

        List<Deal> stale = deals.findByWorkspaceIdAndClosedFalse(ctx.workspaceId()).stream()
                .filter(d -> DealViews.daysSinceActivity(d, now) >= staleDays)
                .sorted(DealViews.BY_AMOUNT_DESC)
                .toList();

        List<Map<String, Object>> views = new ArrayList<>(stale.size());
        double totalValue = 0;
        int critical = 0;
        for (Deal deal : stale) {
            Map<String, Object> v = DealViews.view(deal, now);
            boolean isCritical = (long) v.get("days_since_activity") >= staleDays * 1.5;
            v.put("severity", (isCritical ? Severity.CRITICAL : Severity.WARNING).wireName());
            if (isCritical) critical++;
            totalValue += (double) v.get("amount");
            views.add(v);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total",      stale.size());
        summary.put("totalValue", totalValue);
        summary.put("critical",   critical);
        summary.put("staleDays",  staleDays);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("summary",  summary);
        out.put("deals",    views);
        out.put("topDeals", new ArrayList<>(views.subList(0, Math.min(topN, views.size()))));
        return out;
    }
}
