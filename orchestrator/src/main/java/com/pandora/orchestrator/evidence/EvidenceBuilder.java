package com.pandora.orchestrator.evidence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Append-only accumulator for an {@link EvidenceBundle}.
 *
 * <p>Every {@code add*} method preserves insertion order. {@link #build()}
 * freezes the builder; any later mutation throws {@link IllegalStateException}.
 *
 * <p>Two invariants hold for every bundle this class produces:
 * <ul>
 *   <li>each claim's entity ids refer to records already added, and</li>
 *   <li>a claim built with {@link #addClaimFromRecords} carries the maximum
 *       severity of the records it summarises.</li>
 * </ul>
 * Not thread-safe; one builder per skill run.
 */
public class EvidenceBuilder {

    private final List<EvidenceParameter>    parameters  = new ArrayList<>();
    private final List<DataSourceDescriptor> dataSources = new ArrayList<>();
    private final List<EvidenceRecord>       records     = new ArrayList<>();
    private final List<EvidenceClaim>        claims      = new ArrayList<>();
    private final Set<String>                recordIds   = new HashSet<>();

    private boolean built;

    public EvidenceBuilder addParameter(EvidenceParameter parameter) {
        ensureOpen();
        parameters.add(parameter);
        return this;
    }

    public EvidenceBuilder addDataSource(DataSourceDescriptor source) {
        ensureOpen();
        dataSources.add(source);
        return this;
    }

    public EvidenceBuilder addDataSources(Collection<DataSourceDescriptor> sources) {
        sources.forEach(this::addDataSource);
        return this;
    }

    public EvidenceBuilder addRecord(EvidenceRecord record) {
        ensureOpen();
        records.add(record);
        recordIds.add(record.entityId());
        return this;
    }

    public EvidenceBuilder addRecords(Collection<EvidenceRecord> toAdd) {
        toAdd.forEach(this::addRecord);
        return this;
    }

    /**
     * Add a claim as given.
     *
     * @throws IllegalArgumentException if the claim references an entity id that
     *                                  has no record in this builder
     */
    public EvidenceBuilder addClaim(EvidenceClaim claim) {
        ensureOpen();
        for (String id : claim.entityIds()) {
            if (!recordIds.contains(id)) {
                throw new IllegalArgumentException(
                        "Claim '" + claim.claimId() + "' references unknown record '" + id + "'");
            }
        }
        claims.add(claim);
        return this;
    }

    /**
     * Add a claim summarising {@code supporting}. Entity ids and metric values
     * are taken from the records in order; severity is the highest record severity.
     * Records not yet in the builder are added first.
     */
    public EvidenceBuilder addClaimFromRecords(String claimId,
                                               String claimText,
                                               String metricName,
                                               String thresholdApplied,
                                               List<EvidenceRecord> supporting,
                                               Function<EvidenceRecord, Object> metric) {
        ensureOpen();
        List<String> ids = new ArrayList<>(supporting.size());
        List<Object> values = new ArrayList<>(supporting.size());
        List<Severity> severities = new ArrayList<>(supporting.size());
        for (EvidenceRecord record : supporting) {
            if (!recordIds.contains(record.entityId())) {
                addRecord(record);
            }
            ids.add(record.entityId());
            values.add(metric.apply(record));
            severities.add(record.severity());
        }
        EntityType type = supporting.isEmpty() ? EntityType.DEAL : supporting.get(0).entityType();
        return addClaim(new EvidenceClaim(claimId, claimText, type, ids, metricName, values,
                thresholdApplied, Severity.maxOf(severities)));
    }

    public int recordCount() { return records.size(); }

    public boolean isBuilt() { return built; }

    public EvidenceBundle build() {
        ensureOpen();
        built = true;
        return new EvidenceBundle(parameters, dataSources, records, claims);
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Evidence builder already built; it cannot be modified");
        }
    }
}
