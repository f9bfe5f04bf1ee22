package com.pandora.orchestrator.library;

import com.pandora.orchestrator.model.Deal;
import com.pandora.orchestrator.runtime.RunContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-shaped views of {@link Deal} rows for step outputs, plus the argument
 * helpers the pipeline functions share.
 */
final class DealViews {

    static final int DEFAULT_STALE_DAYS   = 14;
    static final int DEFAULT_CLOSING_DAYS = 30;

    static final Comparator<Deal> BY_AMOUNT_DESC =
            Comparator.comparing((Deal d) -> amountOf(d)).reversed().thenComparing(Deal::getId);

    private DealViews() {}

    static Map<String, Object> view(Deal deal, Instant now) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",          deal.getId());
        m.put("name",        deal.getName());
        m.put("amount",      amountOf(deal).doubleValue());
        m.put("stage",       deal.getStage());
        m.put("owner_email", deal.getOwnerEmail());
        m.put("owner_name",  deal.getOwnerName());
        m.put("close_date",  deal.getCloseDate() == null ? null : deal.getCloseDate().toString());
        m.put("days_in_stage", deal.getDaysInStage());
        m.put("days_since_activity", daysSinceActivity(deal, now));
        return m;
    }

    static BigDecimal amountOf(Deal deal) {
        return deal.getAmount() == null ? BigDecimal.ZERO : deal.getAmount();
    }

    /** Whole days since the last activity; a deal with no activity counts from the epoch. */
    static long daysSinceActivity(Deal deal, Instant now) {
        Instant last = deal.getLastActivityAt() == null ? Instant.EPOCH : deal.getLastActivityAt();
        return Math.max(0, Duration.between(last, now).toDays());
    }

    /** Integer argument, falling back to a business-context value (when a path is given) and then to a default. */
    static int intArg(Map<String, Object> args, String name, RunContext ctx, String contextPath, int fallback) {
        Object value = args.get(name);
        if (value == null && contextPath != null) {
            value = ctx.contextValue(contextPath).orElse(null);
        }
        if (value instanceof Number n) return n.intValue();
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Argument '" + name + "' is not an integer: " + value);
            }
        }
        return fallback;
    }
}
