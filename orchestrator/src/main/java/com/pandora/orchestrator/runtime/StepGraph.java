package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.skill.ExecutionTier;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.StepDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated dependency graph of a skill's steps.
 *
 * <p>{@link #of} rejects, in this order: duplicate step ids, duplicate output
 * keys, a step missing the function or model descriptor its tier needs, a
 * self dependency, a dependency on an unknown step, a cycle, and finally a
 * dependency on a step declared later. A graph that passes can be executed in
 * declaration order.
 */
public final class StepGraph {

    private final String skillId;
    private final Map<String, StepDefinition> steps;            // declaration order
    private final Map<String, Set<String>> dependents;
    private final List<String> topologicalOrder;

    private StepGraph(String skillId, Map<String, StepDefinition> steps,
                      Map<String, Set<String>> dependents, List<String> topologicalOrder) {
        this.skillId = skillId;
        this.steps = steps;
        this.dependents = dependents;
        this.topologicalOrder = topologicalOrder;
    }

    /**
     * @throws InvalidGraphException naming the first offending step
     */
    public static StepGraph of(SkillDefinition skill) {
        String skillId = skill.id();
        Map<String, StepDefinition> byId = new LinkedHashMap<>();
        Set<String> outputKeys = new HashSet<>();

        for (StepDefinition step : skill.steps()) {
            if (byId.putIfAbsent(step.id(), step) != null) {
                throw new InvalidGraphException(skillId, step.id(), "duplicate step id");
            }
            if (!outputKeys.add(step.outputKey())) {
                throw new InvalidGraphException(skillId, step.id(),
                        "output key '" + step.outputKey() + "' is already used by another step");
            }
            if (step.tier() == ExecutionTier.COMPUTE && (step.computeFn() == null || step.computeFn().isBlank())) {
                throw new InvalidGraphException(skillId, step.id(), "compute step has no computeFn");
            }
            if (step.tier() == ExecutionTier.MODEL && step.model() == null) {
                throw new InvalidGraphException(skillId, step.id(), "model step has no model descriptor");
            }
        }

        for (StepDefinition step : byId.values()) {
            for (String dep : step.dependsOn()) {
                if (dep.equals(step.id())) {
                    throw new InvalidGraphException(skillId, step.id(), "step depends on itself");
                }
                if (!byId.containsKey(dep)) {
                    throw new InvalidGraphException(skillId, step.id(), "depends on unknown step '" + dep + "'");
                }
            }
        }

        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        byId.keySet().forEach(id -> dependents.put(id, new LinkedHashSet<>()));
        byId.values().forEach(step -> step.dependsOn().forEach(dep -> dependents.get(dep).add(step.id())));

        List<String> order = kahn(byId, dependents);
        if (order.size() < byId.size()) {
            String stuck = byId.keySet().stream()
                    .filter(id -> !order.contains(id))
                    .findFirst()
                    .orElseThrow();
            throw new InvalidGraphException(skillId, stuck, "dependency cycle");
        }

        Map<String, Integer> position = new HashMap<>();
        int i = 0;
        for (String id : byId.keySet()) position.put(id, i++);
        for (StepDefinition step : byId.values()) {
            for (String dep : step.dependsOn()) {
                if (position.get(dep) > position.get(step.id())) {
                    throw new InvalidGraphException(skillId, step.id(),
                            "depends on '" + dep + "' which is declared after it");
                }
            }
        }

        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        dependents.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return new StepGraph(skillId, Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(frozen), List.copyOf(order));
    }

    private static List<String> kahn(Map<String, StepDefinition> byId, Map<String, Set<String>> dependents) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        byId.values().forEach(s -> inDegree.put(s.id(), s.dependsOn().size()));

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, deg) -> { if (deg == 0) ready.add(id); });

        List<String> order = new ArrayList<>(byId.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : dependents.get(id)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public String skillId() { return skillId; }

    public List<StepDefinition> steps() {
        return List.copyOf(steps.values());
    }

    public StepDefinition step(String id) {
        return steps.get(id);
    }

    public int size() { return steps.size(); }

    public List<String> topologicalOrder() { return topologicalOrder; }

    public Set<String> dependents(String stepId) {
        return dependents.getOrDefault(stepId, Set.of());
    }

    /** Every step that directly or indirectly depends on {@code stepId}. */
    public Set<String> transitiveDependents(String stepId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>(dependents(stepId));
        while (!todo.isEmpty()) {
            String next = todo.poll();
            if (seen.add(next)) {
                todo.addAll(dependents(next));
            }
        }
        return seen;
    }
}
