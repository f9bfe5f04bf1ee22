package com.pandora.orchestrator.skill;

/** Primary period a skill analyses; resolved into concrete dates per run. */
public enum AnalysisWindow {
    CURRENT_QUARTER,
    CURRENT_MONTH,
    TRAILING_90D,
    TRAILING_30D,
    TRAILING_7D,
    ALL_TIME
}
