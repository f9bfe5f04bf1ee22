package com.pandora.orchestrator.skill;

public enum OutputFormat {
    SLACK,
    MARKDOWN,
    JSON,
    STRUCTURED
}
