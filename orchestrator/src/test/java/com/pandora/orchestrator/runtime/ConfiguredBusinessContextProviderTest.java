package com.pandora.orchestrator.runtime;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The configured context must expose thresholds under the paths the
 * pipeline functions and prompts read.
 */
class ConfiguredBusinessContextProviderTest {

    private final ConfiguredBusinessContextProvider provider =
            new ConfiguredBusinessContextProvider(60, 21, 45, 4.0, 250_000);

    @Test
    @SuppressWarnings("unchecked")
    void contextFor_exposesThresholdsUnderGoalsAndTargets() {
        Map<String, Object> ctx = provider.contextFor("ws-1");

        Map<String, Object> goals = (Map<String, Object>) ctx.get("goals_and_targets");
        Map<String, Object> thresholds = (Map<String, Object>) goals.get("thresholds");

        assertThat(thresholds).containsEntry("stale_deal_days", 21).containsEntry("closing_soon_days", 45);
        assertThat(goals).containsEntry("pipeline_coverage_target", 4.0)
                         .containsEntry("quarterly_quota", 250_000.0);
        assertThat(ctx.get("business_model")).isEqualTo(Map.of("sales_cycle_days", 60));
        assertThat(ctx.get("definitions")).isEqualTo(Map.of("stale_deal", "no activity for 21 days"));
    }

    @Test
    void contextFor_isSameForEveryWorkspace() {
        assertThat(provider.contextFor("ws-1")).isSameAs(provider.contextFor("ws-2"));
    }
}
