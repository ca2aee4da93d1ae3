package com.buildfarm.pipeline.integration;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.buildfarm.pipeline.cli.GenerateCommand;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;

/**
 * Integration tests for the complete generation process, from the command
 * line to the written pipeline file.
 */
class GeneratorIntegrationTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static final String GRAPH = """
            specs:
              - {id: r, name: R, version: "1.0", dependencies: [a, b]}
              - {id: a, name: A, version: "1.0", dependencies: [c]}
              - {id: b, name: B, version: "1.0"}
              - {id: c, name: C, version: "1.0"}
            """;

    private static final String CONFIG = """
            ci:
              pipeline-gen:
                - build-job:
                    tags: [default]
                    stage-hint: 0
                    script: [ci-build]
                - match: {package: A}
                  build-job:
                    tags: [gpu]
            """;

    @TempDir
    Path tempDir;

    private Path config;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        config = Files.writeString(tempDir.resolve("ci.yaml"), CONFIG);
        output = tempDir.resolve("out/.gitlab-ci.yml");
    }

    private int run(String environment, String... extraArgs) throws IOException {
        Path env = Files.writeString(tempDir.resolve("env.yaml"), environment);
        List<String> args = new ArrayList<>(List.of(
                "-e", env.toString(), "-c", config.toString(), "-o", output.toString()));
        args.addAll(List.of(extraArgs));
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args.toArray(String[]::new));
    }

    /**
     * Build jobs keyed by package name.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Map<String, Object>> jobs() throws IOException {
        Map<String, Object> doc = YAML.readValue(output.toFile(), new TypeReference<Map<String, Object>>() {});
        Map<String, Map<String, Object>> jobs = new TreeMap<>();
        doc.forEach((key, value) -> {
            if (key.contains(" /")) {
                jobs.put(key.substring(0, key.indexOf('@')), (Map<String, Object>) value);
            }
        });
        return jobs;
    }

    @SuppressWarnings("unchecked")
    private static List<String> needs(Map<String, Object> job) {
        List<Map<String, Object>> needs = (List<Map<String, Object>>) job.getOrDefault("needs", List.of());
        return needs.stream()
                .map(need -> (String) need.get("job"))
                .map(name -> name.substring(0, name.indexOf('@')))
                .sorted()
                .toList();
    }

    @Test
    void testEveryNodeBecomesAJob() throws IOException {
        assertThat(run(GRAPH)).isZero();

        Map<String, Map<String, Object>> jobs = jobs();
        assertThat(jobs).containsOnlyKeys("A", "B", "C", "R");
        assertThat(needs(jobs.get("R"))).containsExactly("A", "B");
        assertThat(needs(jobs.get("A"))).containsExactly("C");
        assertThat(needs(jobs.get("B"))).isEmpty();
        assertThat(needs(jobs.get("C"))).isEmpty();
        assertThat(jobs.get("C").get("stage")).isEqualTo("stage-0");
        assertThat(jobs.get("R").get("stage")).isEqualTo("stage-2");
    }

    @Test
    void testAvailableSpecIsNotRebuilt() throws IOException {
        assertThat(run(GRAPH + "available: [c]\n", "--prune-up-to-date")).isZero();

        Map<String, Map<String, Object>> jobs = jobs();
        assertThat(jobs).containsOnlyKeys("A", "B", "R");
        assertThat(needs(jobs.get("A"))).isEmpty();
        assertThat(needs(jobs.get("R"))).containsExactly("A", "B");
    }

    @Test
    void testChangeAtTheBottomAffectsEverything() throws IOException {
        assertThat(run(GRAPH + "changed: [c]\n", "--affected-only")).isZero();

        assertThat(jobs()).containsOnlyKeys("A", "B", "C", "R");
    }

    @Test
    void testChangedPackageWithDepthLimit() throws IOException {
        assertThat(run(GRAPH + "changed-packages: [B]\n", "--affected-only", "--dependent-depth", "0")).isZero();

        assertThat(jobs()).containsOnlyKeys("B");
    }

    @SuppressWarnings("unchecked")
    @Test
    void testSpecificRuleSetsTags() throws IOException {
        assertThat(run(GRAPH)).isZero();

        Map<String, Map<String, Object>> jobs = jobs();
        assertThat((List<String>) jobs.get("A").get("tags")).containsExactly("gpu");
        for (String name : List.of("B", "C", "R")) {
            assertThat((List<String>) jobs.get(name).get("tags")).containsExactly("default");
        }
    }

    @Test
    void testRegenerationIsByteIdentical() throws IOException {
        assertThat(run(GRAPH, "--pipeline-type", "pull_request", "--stack-name", "e4s")).isZero();
        byte[] first = Files.readAllBytes(output);

        assertThat(run(GRAPH, "--pipeline-type", "pull_request", "--stack-name", "e4s")).isZero();

        assertThat(Files.readAllBytes(output)).isEqualTo(first);
    }

    @Test
    void testEverythingPrunedWritesNoopJob() throws IOException {
        assertThat(run(GRAPH + "available: [r, a, b, c]\n", "--prune-up-to-date")).isZero();

        Map<String, Object> doc = YAML.readValue(output.toFile(), new TypeReference<Map<String, Object>>() {});
        assertThat(doc).containsKey("no-specs-to-rebuild");
        assertThat(jobs()).isEmpty();
    }

    @Test
    void testMissingAttributesFailWithoutOutput() throws IOException {
        Files.writeString(config, """
                pipeline-gen:
                  - match: {package: A}
                    build-job:
                      tags: [gpu]
                      stage-hint: 0
                      script: [ci-build]
                """);

        assertThat(run(GRAPH)).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void testUnknownPlatformFails() throws IOException {
        assertThat(run(GRAPH, "--platform", "jenkins")).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void testCycleFails() throws IOException {
        String cyclic = """
                specs:
                  - {id: a, name: A, dependencies: [b]}
                  - {id: b, name: B, dependencies: [a]}
                roots: [a]
                """;

        assertThat(run(cyclic)).isEqualTo(1);
        assertThat(output).doesNotExist();
    }
}
