package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.skill.ExecutionTier;
import com.pandora.orchestrator.skill.ModelStepDescriptor;
import com.pandora.orchestrator.skill.SkillDefinition;
import com.pandora.orchestrator.skill.StepDefinition;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepGraphTest {

    private static StepDefinition step(String id, String... deps) {
        return StepDefinition.compute(id, "fn", id + "_out", Map.of(), deps);
    }

    private static SkillDefinition skill(StepDefinition... steps) {
        SkillDefinition.Builder b = SkillDefinition.builder("s");
        for (StepDefinition step : steps) b.step(step);
        return b.build();
    }

    @Test
    void diamond_topologicalOrderRespectsDependencies() {
        StepGraph graph = StepGraph.of(skill(
                step("a"), step("b", "a"), step("c", "a"), step("d", "b", "c")));

        assertThat(graph.topologicalOrder()).containsExactly("a", "b", "c", "d");
        assertThat(graph.dependents("a")).containsExactly("b", "c");
        assertThat(graph.transitiveDependents("a")).containsExactlyInAnyOrder("b", "c", "d");
        assertThat(graph.transitiveDependents("d")).isEmpty();
    }

    @Test
    void duplicateStepId_rejected() {
        assertThatThrownBy(() -> StepGraph.of(skill(
                StepDefinition.compute("a", "fn", "x", Map.of()),
                StepDefinition.compute("a", "fn", "y", Map.of()))))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("duplicate step id");
    }

    @Test
    void duplicateOutputKey_rejected() {
        assertThatThrownBy(() -> StepGraph.of(skill(
                StepDefinition.compute("a", "fn", "same", Map.of()),
                StepDefinition.compute("b", "fn", "same", Map.of()))))
                .isInstanceOf(InvalidGraphException.class)
                .extracting(e -> ((InvalidGraphException) e).getStepId())
                .isEqualTo("b");
    }

    @Test
    void computeStepWithoutFunction_rejected() {
        StepDefinition bad = new StepDefinition("a", "a", ExecutionTier.COMPUTE, null, null, Map.of(), Set.of(), "out");

        assertThatThrownBy(() -> StepGraph.of(skill(bad)))
                .hasMessageContaining("no computeFn");
    }

    @Test
    void modelStepWithoutDescriptor_rejected() {
        StepDefinition bad = new StepDefinition("m", "m", ExecutionTier.MODEL, null, null, Map.of(), Set.of(), "out");

        assertThatThrownBy(() -> StepGraph.of(skill(bad)))
                .hasMessageContaining("no model descriptor");
    }

    @Test
    void selfDependency_rejected() {
        assertThatThrownBy(() -> StepGraph.of(skill(step("a", "a"))))
                .hasMessageContaining("depends on itself");
    }

    @Test
    void danglingDependency_rejected() {
        assertThatThrownBy(() -> StepGraph.of(skill(step("a"), step("b", "ghost"))))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("unknown step 'ghost'");
    }

    @Test
    void cycle_reportedAsCycleNotForwardReference() {
        assertThatThrownBy(() -> StepGraph.of(skill(step("a", "b"), step("b", "a"))))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void forwardReference_rejected() {
        assertThatThrownBy(() -> StepGraph.of(skill(step("a", "b"), step("b"))))
                .hasMessageContaining("declared after it");
    }

    @Test
    void modelStep_withDescriptor_accepted() {
        StepGraph graph = StepGraph.of(skill(
                step("a"),
                StepDefinition.model("m", ModelStepDescriptor.reason("Summarise {{a_out}}"), "summary", "a")));

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.step("m").tier()).isEqualTo(ExecutionTier.MODEL);
    }
}
