package com.pandora.orchestrator.evidence;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordAdaptersTest {

    private static final FieldMapping MAPPING = FieldMapping.create()
            .canonical("amount", FieldKind.NUMBER, "amount", "Amount", "dealAmount")
            .canonical("stage", FieldKind.STRING, "stage", "dealstage")
            .canonical("close_date", FieldKind.DATE, "close_date", "closeDate")
            .derived("is_closed", FieldKind.BOOLEAN, "is_closed", "isClosed");

    record Rep(String email, String name) {}

    @Test
    void dealToRecord_resolvesAliasesInPriorityOrder() {
        Map<String, Object> raw = Map.of(
                "dealId", "d-42",
                "dealName", "Acme renewal",
                "ownerEmail", "sam@acme.io",
                "Amount", 50000,
                "dealAmount", 1,
                "dealstage", "negotiation",
                "closeDate", "2026-04-30T00:00:00Z",
                "isClosed", "no");

        EvidenceRecord record = RecordAdapters.dealToRecord(raw, MAPPING, Map.of("days_until_close", 12), Severity.WARNING);

        assertThat(record.entityId()).isEqualTo("d-42");
        assertThat(record.entityName()).isEqualTo("Acme renewal");
        assertThat(record.ownerEmail()).isEqualTo("sam@acme.io");
        assertThat(record.entityType()).isEqualTo(EntityType.DEAL);
        assertThat(record.canonicalFields())
                .containsEntry("amount", 50000)
                .containsEntry("stage", "negotiation")
                .containsEntry("close_date", LocalDate.of(2026, 4, 30));
        assertThat(record.derivedFields())
                .containsEntry("is_closed", false)
                .containsEntry("days_until_close", 12);
        assertThat(record.severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void dealToRecord_missingValues_takeKindDefaults() {
        EvidenceRecord record = RecordAdapters.dealToRecord(Map.of("id", "d-1"), MAPPING, null, null);

        assertThat(record.entityName()).isEqualTo("Unnamed");
        assertThat(record.ownerEmail()).isNull();
        assertThat(record.canonicalFields())
                .containsEntry("amount", 0)
                .containsEntry("stage", "")
                .containsEntry("close_date", null);
        assertThat(record.derivedFields()).containsEntry("is_closed", false);
        assertThat(record.severity()).isEqualTo(Severity.HEALTHY);
    }

    @Test
    void dealToRecord_malformedValue_isDefaultedNotFatal() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "d-2");
        raw.put("amount", "lots");
        raw.put("close_date", "next tuesday");

        EvidenceRecord record = RecordAdapters.dealToRecord(raw, MAPPING, Map.of(), Severity.HEALTHY);

        assertThat(record.canonicalFields()).containsEntry("amount", 0).containsEntry("close_date", null);
    }

    @Test
    void dealToRecord_numericString_isParsed() {
        EvidenceRecord record = RecordAdapters.dealToRecord(
                Map.of("id", "d-3", "amount", " 1250.50 "), MAPPING, Map.of(), Severity.HEALTHY);

        assertThat(record.canonicalFields()).containsEntry("amount", 1250.5);
    }

    @Test
    void dealToRecord_nonStringKeys_areReadByTheirText() {
        Map<Object, Object> raw = new HashMap<>();
        raw.put("id", "d-7");
        raw.put(42, "ignored");
        raw.put(new StringBuilder("amount"), 900);

        EvidenceRecord record = RecordAdapters.dealToRecord(raw, MAPPING, Map.of(), Severity.HEALTHY);

        assertThat(record.entityId()).isEqualTo("d-7");
        assertThat(record.canonicalFields()).containsEntry("amount", 900);
    }

    @Test
    void dealToRecord_noId_recordsEmptyId() {
        EvidenceRecord record = RecordAdapters.dealToRecord(Map.of("name", "orphan"), MAPPING, Map.of(), Severity.HEALTHY);

        assertThat(record.entityId()).isEmpty();
        assertThat(record.entityName()).isEqualTo("orphan");
    }

    @Test
    void repToRecord_usesEmailAsIdentity() {
        EvidenceRecord record = RecordAdapters.repToRecord(new Rep("kim@acme.io", "Kim"),
                FieldMapping.create(), Map.of("coverage_ratio", 2.1), Severity.WARNING);

        assertThat(record.entityId()).isEqualTo("kim@acme.io");
        assertThat(record.entityName()).isEqualTo("Kim");
        assertThat(record.entityType()).isEqualTo(EntityType.REP);
        assertThat(record.derivedFields()).containsEntry("coverage_ratio", 2.1);
    }
}
