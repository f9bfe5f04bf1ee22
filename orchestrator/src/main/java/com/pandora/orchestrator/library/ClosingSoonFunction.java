package com.pandora.orchestrator.library;

import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.model.Deal;
import com.pandora.orchestrator.repository.DealRepository;
import com.pandora.orchestrator.runtime.RunContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open deals whose close date falls within the next {@code daysAhead} days.
 *
 * Args: {@code daysAhead} (default from business context), {@code topN}.
 */
@Component
public class ClosingSoonFunction implements StepFunction {

    private final DealRepository deals;
    private final Clock clock;

    public ClosingSoonFunction(DealRepository deals, Clock clock) {
        this.deals = deals;
        this.clock = clock;
    }

    @Override
    public String name() { return "aggregateClosingSoon"; }

    @Override
    public Object apply(Map<String, Object> args, RunContext ctx) {
        int daysAhead = DealViews.intArg(args, "daysAhead", ctx,
                "goals_and_targets.thresholds.closing_soon_days", DealViews.DEFAULT_CLOSING_DAYS);
        int topN = DealViews.intArg(args, "topN", ctx, null, 10);
        Instant now = clock.instant();
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate horizon = today.plusDays(daysAhead);

        List<Deal> closing = deals.findByWorkspaceIdAndClosedFalse(ctx.workspaceId()).stream()
                .filter(d -> d.getCloseDate() != null
                        && !d.getCloseDate().isBefore(today)
                        && !d.getCloseDate().isAfter(horizon))
                .sorted(DealViews.BY_AMOUNT_DESC)
                .toList();

        List<Map<String, Object>> views = new ArrayList<>(closing.size());
        double totalValue = 0;
        for (Deal deal : closing) {
            Map<String, Object> v = DealViews.view(deal, now);
            v.put("days_until_close", ChronoUnit.DAYS.between(today, deal.getCloseDate()));
            totalValue += (double) v.get("amount");
            views.add(v);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total",      closing.size());
        summary.put("totalValue", totalValue);
        summary.put("daysAhead",  daysAhead);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("summary",  summary);
        out.put("deals",    views);
        out.put("topDeals", new ArrayList<>(views.subList(0, Math.min(topN, views.size()))));
        return out;
    }
}
