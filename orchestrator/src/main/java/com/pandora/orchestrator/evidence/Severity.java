package com.pandora.orchestrator.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Severity vocabulary shared by evidence records, claims and alerting.
 * Declaration order is the ranking: {@code CRITICAL > WARNING > HEALTHY}.
 */
public enum Severity {
    HEALTHY,
    WARNING,
    CRITICAL;

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Highest severity in the collection; HEALTHY for an empty one. */
    public static Severity maxOf(Collection<Severity> severities) {
        Severity result = HEALTHY;
        for (Severity s : severities) {
            result = max(result, s);
        }
        return result;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
