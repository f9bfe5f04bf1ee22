package com.pandora.orchestrator.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {
    DEAL,
    CONTACT,
    ACCOUNT,
    CONVERSATION,
    REP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
