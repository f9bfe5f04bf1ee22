package com.pandora.orchestrator.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process catalog of definitions keyed by id.
 *
 * <p>Populated once at startup (single-threaded) through {@link #registerAll}
 * and read concurrently afterwards. Lookups never throw: {@link #get} returns
 * {@link Optional#empty()} for an unknown id.
 *
 * <p>The duplicate-id behaviour is chosen per instance, see {@link DuplicatePolicy}.
 *
 * @param <D> the definition type
 */
public class DefinitionRegistry<D extends RegistryEntry> {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final String name;
    private final DuplicatePolicy duplicatePolicy;
    private final Map<String, D> entries = new ConcurrentHashMap<>();

    public DefinitionRegistry(String name, DuplicatePolicy duplicatePolicy) {
        this.name = name;
        this.duplicatePolicy = duplicatePolicy;
    }

    // ------------------------------------------------------------------
    // Population
    // ------------------------------------------------------------------

    /**
     * @throws DuplicateDefinitionException if the id is already present and the
     *                                      policy is {@link DuplicatePolicy#REJECT}
     */
    public void register(D definition) {
        String id = definition.id();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Cannot register a " + name + " definition without an id");
        }
        D previous = entries.get(id);
        if (previous != null) {
            if (duplicatePolicy == DuplicatePolicy.REJECT) {
                throw new DuplicateDefinitionException(name, id);
            }
            log.warn("Replacing {} definition '{}' (duplicate registration)", name, id);
        }
        entries.put(id, definition);
        log.debug("Registered {} '{}'", name, id);
    }

    public void registerAll(Collection<? extends D> definitions) {
        definitions.forEach(this::register);
        log.info("{} registry holds {} definition(s)", name, entries.size());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<D> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    /** All definitions, sorted by id. */
    public List<D> list() {
        return entries.values().stream()
                .sorted(Comparator.comparing(RegistryEntry::id))
                .toList();
    }

    public int size() { return entries.size(); }

    public DuplicatePolicy duplicatePolicy() { return duplicatePolicy; }

    protected void replace(String id, D definition) {
        entries.put(id, definition);
    }
}
