package com.pandora.orchestrator.evidence;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Frozen output of an {@link EvidenceBuilder}. Lists keep insertion order.
 */
public record EvidenceBundle(
        List<EvidenceParameter>    parameters,
        List<DataSourceDescriptor> dataSources,
        List<EvidenceRecord>       records,
        List<EvidenceClaim>        claims) {

    public EvidenceBundle {
        parameters  = parameters == null ? List.of() : List.copyOf(parameters);
        dataSources = dataSources == null ? List.of() : List.copyOf(dataSources);
        records     = records == null ? List.of() : List.copyOf(records);
        claims      = claims == null ? List.of() : List.copyOf(claims);
    }

    public static EvidenceBundle empty() {
        return new EvidenceBundle(List.of(), List.of(), List.of(), List.of());
    }

    public Set<String> recordIds() {
        Set<String> ids = new LinkedHashSet<>();
        records.forEach(r -> ids.add(r.entityId()));
        return ids;
    }

    public Optional<EvidenceRecord> findRecord(String entityId) {
        return records.stream().filter(r -> r.entityId().equals(entityId)).findFirst();
    }

    public Optional<EvidenceClaim> findClaim(String claimId) {
        return claims.stream().filter(c -> c.claimId().equals(claimId)).findFirst();
    }
}
