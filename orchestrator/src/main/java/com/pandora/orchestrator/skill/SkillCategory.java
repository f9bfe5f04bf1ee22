package com.pandora.orchestrator.skill;

public enum SkillCategory {
    PIPELINE,
    DEALS,
    ACCOUNTS,
    CALLS,
    FORECASTING,
    REPORTING,
    OPERATIONS
}
