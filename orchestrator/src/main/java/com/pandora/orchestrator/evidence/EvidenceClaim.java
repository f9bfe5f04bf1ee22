package com.pandora.orchestrator.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement the skill's narrative makes, tied to the records that support it.
 *
 * @param entityIds    ids of supporting records; each must exist in the same bundle
 * @param metricValues one value per entity, in the order of {@code entityIds}
 */
public record EvidenceClaim(
        String       claimId,
        String       claimText,
        EntityType   entityType,
        List<String> entityIds,
        String       metricName,
        List<Object> metricValues,
        String       thresholdApplied,
        Severity     severity) {

    public EvidenceClaim {
        if (claimId == null || claimId.isBlank()) {
            throw new IllegalArgumentException("Claim id is required");
        }
        if (claimText == null) claimText = "";
        if (entityType == null) entityType = EntityType.DEAL;
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        metricValues = metricValues == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(metricValues));
        if (thresholdApplied == null) thresholdApplied = "";
        if (severity == null) severity = Severity.HEALTHY;
    }
}
