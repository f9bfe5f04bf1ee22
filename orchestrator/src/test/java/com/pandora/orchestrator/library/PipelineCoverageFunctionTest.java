package com.pandora.orchestrator.library;

import com.pandora.orchestrator.model.Deal;
import com.pandora.orchestrator.repository.DealRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineCoverageFunctionTest {

    @Mock DealRepository deals;

    PipelineCoverageFunction fn;

    @BeforeEach
    void setUp() {
        fn = new PipelineCoverageFunction(deals);
        when(deals.findByWorkspaceIdAndClosedFalse("ws-1")).thenReturn(List.of(
                deal("a", "proposal", 100_000),
                deal("b", "proposal", 50_000),
                deal("c", null, 30_000)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_quotaConfigured_reportsRatioAndGap() {
        Map<String, Object> context = Map.of("goals_and_targets", Map.of("quarterly_quota", 90_000));

        Map<String, Object> out = (Map<String, Object>) fn.apply(Map.of(), StaleDealsFunctionTest.ctx(context));

        assertThat(out)
                .containsEntry("openDeals", 3)
                .containsEntry("totalPipeline", 180_000.0)
                .containsEntry("coverageRatio", 2.0)
                .containsEntry("coverageTarget", 3.0)
                .containsEntry("coverageGap", true);
        Map<String, Map<String, Object>> byStage = (Map<String, Map<String, Object>>) out.get("byStage");
        assertThat(byStage.get("proposal")).containsEntry("count", 2).containsEntry("value", 150_000.0);
        assertThat(byStage.get("unknown")).containsEntry("count", 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_noQuota_ratioIsNullAndNoGap() {
        Map<String, Object> out = (Map<String, Object>) fn.apply(Map.of(), StaleDealsFunctionTest.ctx(Map.of()));

        assertThat(out.get("coverageRatio")).isNull();
        assertThat(out).containsEntry("coverageGap", false);
    }

    private static Deal deal(String id, String stage, int amount) {
        Deal d = new Deal(id, "ws-1", "hubspot", "hs-" + id, "Deal " + id);
        d.setStage(stage);
        d.setAmount(BigDecimal.valueOf(amount));
        return d;
    }
}
