package com.pandora.orchestrator.library;

import com.pandora.orchestrator.evidence.DataSourceCatalog;
import com.pandora.orchestrator.evidence.EntityType;
import com.pandora.orchestrator.evidence.EvidenceBuilder;
import com.pandora.orchestrator.evidence.EvidenceBundle;
import com.pandora.orchestrator.evidence.EvidenceClaim;
import com.pandora.orchestrator.evidence.EvidenceParameter;
import com.pandora.orchestrator.evidence.EvidenceRecord;
import com.pandora.orchestrator.evidence.FieldKind;
import com.pandora.orchestrator.evidence.FieldMapping;
import com.pandora.orchestrator.evidence.RecordAdapters;
import com.pandora.orchestrator.evidence.Severity;
import com.pandora.orchestrator.evidence.SkillEvidenceBuilder;
import com.pandora.orchestrator.runtime.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evidence for {@value PipelineHygieneSkill#ID}: one record per flagged deal,
 * claims {@code stale_deals}, {@code closing_soon} and {@code coverage_gap}.
 *
 * Missing step outputs (a failed or skipped step) contribute nothing.
 */
@Component
public class PipelineHygieneEvidenceBuilder implements SkillEvidenceBuilder {

    private static final Logger log = LoggerFactory.getLogger(PipelineHygieneEvidenceBuilder.class);

    static final List<String> CRM_SOURCES = List.of("hubspot", "salesforce");

    static final FieldMapping DEAL_FIELDS = FieldMapping.create()
            .canonical("deal_name", FieldKind.STRING, "name", "deal_name", "dealName")
            .canonical("amount", FieldKind.NUMBER, "amount", "Amount")
            .canonical("stage", FieldKind.STRING, "stage", "dealstage")
            .canonical("owner", FieldKind.STRING, "owner_name", "owner_email", "owner")
            .canonical("close_date", FieldKind.DATE, "close_date", "closeDate")
            .derived("days_since_activity", FieldKind.NUMBER, "days_since_activity", "daysStale")
            .derived("days_until_close", FieldKind.NUMBER, "days_until_close", "daysToClose");

    private final DataSourceCatalog dataSources;

    public PipelineHygieneEvidenceBuilder(DataSourceCatalog dataSources) {
        this.dataSources = dataSources;
    }

    @Override
    public String skillId() { return PipelineHygieneSkill.ID; }

    @Override
    public EvidenceBundle build(RunContext ctx) {
        EvidenceBuilder eb = new EvidenceBuilder();

        int staleDays = DealViews.intArg(Map.of(), "staleDays", ctx,
                "goals_and_targets.thresholds.stale_deal_days", DealViews.DEFAULT_STALE_DAYS);
        int closingDays = DealViews.intArg(Map.of(), "daysAhead", ctx,
                "goals_and_targets.thresholds.closing_soon_days", DealViews.DEFAULT_CLOSING_DAYS);
        double coverageTarget = number(ctx.contextValue("goals_and_targets.pipeline_coverage_target").orElse(3.0));

        eb.addParameter(new EvidenceParameter("stale_threshold_days", "Stale Threshold (days)", staleDays,
                "Days without activity before a deal is flagged as stale", true));
        eb.addParameter(new EvidenceParameter("closing_soon_days", "Closing Soon Window (days)", closingDays,
                "Deals closing within this many days are reviewed", true));
        eb.addParameter(new EvidenceParameter("pipeline_coverage_target", "Pipeline Coverage Target",
                coverageTarget, "Target pipeline-to-quota coverage ratio", true));

        eb.addDataSources(dataSources.describe(ctx.workspaceId(), CRM_SOURCES));

        Map<String, Map<String, Object>> classifications = classificationsById(ctx);

        // a deal can be both stale and closing soon; keep one record with the higher severity
        Map<String, EvidenceRecord> records = new LinkedHashMap<>();
        List<EvidenceRecord> staleRecords = new ArrayList<>();
        for (Map<String, Object> deal : deals(ctx, PipelineHygieneSkill.STALE_KEY)) {
            Severity severity = severityOf(deal, Severity.WARNING);
            EvidenceRecord r = RecordAdapters.dealToRecord(deal, DEAL_FIELDS,
                    derived("stale", classifications.get(String.valueOf(deal.get("id"))), "Review and re-engage"),
                    severity);
            records.put(r.entityId(), r);
            staleRecords.add(r);
        }
        List<String> closingIds = new ArrayList<>();
        for (Map<String, Object> deal : deals(ctx, PipelineHygieneSkill.CLOSING_KEY)) {
            String id = String.valueOf(deal.get("id"));
            closingIds.add(id);
            EvidenceRecord r = RecordAdapters.dealToRecord(deal, DEAL_FIELDS,
                    derived("closing_soon", classifications.get(id), "Monitor closely"), Severity.HEALTHY);
            records.merge(id, r, PipelineHygieneEvidenceBuilder::mergeFlags);
        }
        eb.addRecords(records.values());

        if (!staleRecords.isEmpty()) {
            double value = staleRecords.stream().mapToDouble(r -> number(r.canonicalFields().get("amount"))).sum();
            eb.addClaimFromRecords("stale_deals",
                    "%d deals worth %s are stale (%d+ days, zero activity)".formatted(staleRecords.size(), money(value), staleDays),
                    "days_since_activity", staleDays + " days", staleRecords,
                    r -> r.derivedFields().get("days_since_activity"));
        }

        List<EvidenceRecord> closingRecords = closingIds.stream().map(records::get).toList();
        if (!closingRecords.isEmpty()) {
            double value = closingRecords.stream().mapToDouble(r -> number(r.canonicalFields().get("amount"))).sum();
            eb.addClaimFromRecords("closing_soon",
                    "%d deals worth %s closing within %d days".formatted(closingRecords.size(), money(value), closingDays),
                    "days_until_close", closingDays + " days", closingRecords,
                    r -> r.derivedFields().get("days_until_close"));
        }

        addCoverageClaim(eb, ctx, coverageTarget);
        return eb.build();
    }

    private static void addCoverageClaim(EvidenceBuilder eb, RunContext ctx, double target) {
        Object summary = ctx.output(PipelineHygieneSkill.SUMMARY_KEY).orElse(null);
        if (!(summary instanceof Map<?, ?> s) || !(s.get("coverageRatio") instanceof Number ratioValue)) {
            return;
        }
        double ratio = ratioValue.doubleValue();
        if (ratio >= target) {
            return;
        }
        Severity severity = ratio < target * 0.5 ? Severity.CRITICAL : Severity.WARNING;
        eb.addClaim(new EvidenceClaim("coverage_gap",
                String.format(Locale.ROOT, "Pipeline coverage at %.1fx vs %.1fx target", ratio, target),
                EntityType.DEAL, List.of(), "coverage_ratio", List.of(ratio),
                String.format(Locale.ROOT, "%.1fx target", target), severity));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Map<String, Object>> deals(RunContext ctx, String outputKey) {
        Object out = ctx.output(outputKey).orElse(null);
        if (out instanceof Map<?, ?> m && m.get("deals") instanceof List<?> list) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map<?, ?> deal) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    deal.forEach((k, v) -> copy.put(String.valueOf(k), v));
                    result.add(copy);
                }
            }
            return result;
        }
        return List.of();
    }

    /** Model classifications keyed by deal id; empty when the model step did not produce a list. */
    private static Map<String, Map<String, Object>> classificationsById(RunContext ctx) {
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        Object out = ctx.output(PipelineHygieneSkill.CLASSIFICATIONS_KEY).orElse(null);
        if (!(out instanceof List<?> list)) {
            if (out != null) {
                log.warn("Deal classifications for run {} are not a list; ignoring them", ctx.runId());
            }
            return byId;
        }
        for (Object item : list) {
            if (item instanceof Map<?, ?> m && m.get("dealId") != null) {
                Map<String, Object> c = new LinkedHashMap<>();
                m.forEach((k, v) -> c.put(String.valueOf(k), v));
                byId.put(String.valueOf(m.get("dealId")), c);
            }
        }
        return byId;
    }

    private static Map<String, Object> derived(String flag, Map<String, Object> classification, String defaultAction) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("flag", flag);
        d.put("root_cause", classification == null ? "unknown" : classification.getOrDefault("root_cause", "unknown"));
        d.put("suggested_action", classification == null
                ? defaultAction
                : classification.getOrDefault("suggested_action", defaultAction));
        return d;
    }

    /** Stale record wins; it picks up the closing window and the higher severity. */
    static EvidenceRecord mergeFlags(EvidenceRecord stale, EvidenceRecord closing) {
        Map<String, Object> derivedFields = new LinkedHashMap<>(stale.derivedFields());
        derivedFields.put("days_until_close", closing.derivedFields().get("days_until_close"));
        derivedFields.put("flag", "stale,closing_soon");
        return new EvidenceRecord(stale.entityId(), stale.entityType(), stale.entityName(),
                stale.ownerEmail(), stale.ownerName(), stale.canonicalFields(), derivedFields,
                Severity.max(stale.severity(), closing.severity()));
    }

    private static Severity severityOf(Map<String, Object> deal, Severity fallback) {
        Object raw = deal.get("severity");
        if (raw == null) return fallback;
        try {
            return Severity.fromWireName(raw.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Deal {} has unknown severity '{}'; using {}", deal.get("id"), raw, fallback);
            return fallback;
        }
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static String money(double value) {
        return "$" + Math.round(value / 1000) + "K";
    }
}
