package com.pandora.orchestrator.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declares which source keys feed each field of an {@link EvidenceRecord}.
 *
 * <p>Connectors name the same thing differently ({@code amount},
 * {@code Amount}, {@code dealAmount}); each target field lists its aliases in
 * priority order and the first present, non-null one wins. Source keys not
 * mentioned here are ignored.
 */
public final class FieldMapping {

    public record Field(String target, FieldKind kind, List<String> aliases) {
        public Field {
            aliases = aliases.isEmpty() ? List.of(target) : List.copyOf(aliases);
        }
    }

    private final List<Field> canonical = new ArrayList<>();
    private final List<Field> derived = new ArrayList<>();

    public static FieldMapping create() {
        return new FieldMapping();
    }

    public FieldMapping canonical(String target, FieldKind kind, String... aliases) {
        canonical.add(new Field(target, kind, List.of(aliases)));
        return this;
    }

    public FieldMapping derived(String target, FieldKind kind, String... aliases) {
        derived.add(new Field(target, kind, List.of(aliases)));
        return this;
    }

    public List<Field> canonicalFields() { return Collections.unmodifiableList(canonical); }

    public List<Field> derivedFields() { return Collections.unmodifiableList(derived); }
}
