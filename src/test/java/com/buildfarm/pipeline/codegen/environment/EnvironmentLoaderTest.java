package com.buildfarm.pipeline.codegen.environment;

import static org.assertj.core.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.buildfarm.pipeline.codegen.exception.InputFormatException;
import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;

/**
 * Unit tests for EnvironmentLoader.
 */
class EnvironmentLoaderTest {

    @TempDir
    Path tempDir;

    private final EnvironmentLoader loader = new EnvironmentLoader();

    private static ConcreteEnvironment load(EnvironmentLoader loader, String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
    }

    @Test
    void testWiresDependenciesAndFlags() {
        ConcreteEnvironment env = load(loader, """
                specs:
                  - id: curl
                    name: curl
                    version: 8.5.0
                    compiler: gcc@12.2.0
                    platform: linux-x86_64
                    variants:
                      libssh2: false
                      tls: openssl
                    dependencies: [zlib, openssl]
                  - id: openssl
                    name: openssl
                    version: 3.1.3
                    dependencies: [zlib]
                  - id: zlib
                    name: zlib
                    version: 1.3
                available: [zlib]
                broken: [openssl]
                changed: [curl]
                changed-packages: [zlib]
                """);

        assertThat(env.getRoots()).extracting(BuildSpec::getName).containsExactly("curl");
        BuildSpec curl = env.getRoots().get(0);
        assertThat(curl.getVariants()).containsEntry("libssh2", "false").containsEntry("tls", "openssl");
        assertThat(curl.getDependencies()).extracting(BuildSpec::getName).containsExactly("zlib", "openssl");
        // the same zlib object is shared by both dependents
        assertThat(curl.getDependencies().get(0)).isSameAs(curl.getDependencies().get(1).getDependencies().get(0));
        assertThat(env.getAvailableSpecs()).extracting(BuildSpec::getName).containsExactly("zlib");
        assertThat(env.getBrokenSpecs()).extracting(BuildSpec::getName).containsExactly("openssl");
        assertThat(env.getChangedSpecs()).extracting(BuildSpec::getName).containsExactly("curl");
        assertThat(env.getChangedPackages()).containsExactly("zlib");
    }

    @Test
    void testExplicitRootsAreUsed() {
        ConcreteEnvironment env = load(loader, """
                specs:
                  - {id: a, name: A, dependencies: [b]}
                  - {id: b, name: B}
                roots: [a, b]
                """);

        assertThat(env.getRoots()).extracting(BuildSpec::getName).containsExactly("A", "B");
    }

    @Test
    void testJsonDocumentIsAccepted() throws IOException {
        Path file = tempDir.resolve("env.json");
        Files.writeString(file, """
                {"specs": [{"id": "a", "name": "A", "version": "1.0", "external": true}]}
                """);

        ConcreteEnvironment env = loader.load(file);

        assertThat(env.getRoots()).singleElement().satisfies(spec -> assertThat(spec.isExternal()).isTrue());
    }

    @Test
    void testUnknownDependencyIsReported() {
        assertThatThrownBy(() -> load(loader, """
                specs:
                  - {id: a, name: A, dependencies: [missing]}
                """))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testDuplicateIdIsReported() {
        assertThatThrownBy(() -> load(loader, """
                specs:
                  - {id: a, name: A}
                  - {id: a, name: B}
                """))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("duplicate spec id a");
    }

    @Test
    void testUnknownKeyIsReported() {
        assertThatThrownBy(() -> load(loader, """
                specs: []
                spex: []
                """))
                .isInstanceOf(InputFormatException.class);
    }

    @Test
    void testMissingFileIsReported() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.yaml")))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("nope.yaml");
    }
}
