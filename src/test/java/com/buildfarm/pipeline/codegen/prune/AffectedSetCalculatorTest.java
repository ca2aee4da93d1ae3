package com.buildfarm.pipeline.codegen.prune;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * Unit tests for AffectedSetCalculator.
 */
class AffectedSetCalculatorTest {

    private final AffectedSetCalculator calculator = new AffectedSetCalculator();

    private static SpecNode node(String id, String... deps) {
        return SpecNode.builder().identity(id).name(id).dependencies(List.of(deps)).build();
    }

    /**
     * app -> lib -> zlib, app -> tool, other -> zlib
     */
    private static PipelineGraph graph() {
        return new PipelineGraph(List.of(
                node("app", "lib", "tool"),
                node("lib", "zlib"),
                node("tool"),
                node("zlib"),
                node("other", "zlib")), List.of("app", "other"));
    }

    @ParameterizedTest
    @CsvSource({
            "0, zlib",
            "1, lib other zlib",
            "2, app lib other tool zlib",
    })
    void testDependentDepthLimitsUpwardWalk(int depth, String expected) {
        Set<String> affected = calculator.compute(graph(), List.of("zlib"), depth);

        assertThat(affected).containsExactlyElementsOf(List.of(expected.split(" ")));
    }

    @Test
    void testUnlimitedDepthReachesRoots() {
        assertThat(calculator.compute(graph(), List.of("zlib"), null))
                .containsExactly("app", "lib", "other", "tool", "zlib");
    }

    @Test
    void testNegativeDepthKeepsChangedNodes() {
        assertThat(calculator.compute(graph(), List.of("zlib"), -1)).containsExactly("zlib");
        assertThat(calculator.compute(graph(), List.of("app"), -3)).containsExactly("app", "lib", "tool", "zlib");
    }

    @Test
    void testDependenciesOfChangedNodeAreAffected() {
        assertThat(calculator.compute(graph(), List.of("lib"), 0)).containsExactly("lib", "zlib");
    }

    @Test
    void testUnknownChangedIdentityIsIgnored() {
        assertThat(calculator.compute(graph(), List.of("missing"), null)).isEmpty();
    }
}
