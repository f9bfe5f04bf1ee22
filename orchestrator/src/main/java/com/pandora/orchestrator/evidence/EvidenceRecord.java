package com.pandora.orchestrator.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One evaluated entity.
 *
 * @param canonicalFields source values normalised to the skill's field names
 * @param derivedFields   values the skill computed (flags, causes, actions)
 * @param severity        decided by the skill's business logic, never by the builder
 */
public record EvidenceRecord(
        String              entityId,
        EntityType          entityType,
        String              entityName,
        String              ownerEmail,
        String              ownerName,
        Map<String, Object> canonicalFields,
        Map<String, Object> derivedFields,
        Severity            severity) {

    public EvidenceRecord {
        if (entityId == null) entityId = "";
        if (entityType == null) entityType = EntityType.DEAL;
        if (entityName == null) entityName = "";
        if (severity == null) severity = Severity.HEALTHY;
        // values may legitimately be null (a missing close date), so no Map.copyOf
        canonicalFields = canonicalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(canonicalFields));
        derivedFields = derivedFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(derivedFields));
    }
}
