package com.pandora.orchestrator.skill;

/** Events that can start a skill run. */
public enum ScheduleTrigger {
    POST_SYNC,
    ON_DEMAND,
    CRON
}
