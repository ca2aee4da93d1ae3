package com.buildfarm.pipeline.codegen.generator;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.buildfarm.pipeline.codegen.exception.DuplicateGeneratorException;
import com.buildfarm.pipeline.codegen.exception.UnknownGeneratorException;
import com.buildfarm.pipeline.codegen.generator.gitlab.GitlabPipelineGenerator;
import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;

/**
 * Unit tests for GeneratorRegistry.
 */
class GeneratorRegistryTest {

    private static PipelineGenerator named(String platform) {
        return new PipelineGenerator() {
            @Override
            public String platform() {
                return platform;
            }

            @Override
            public void generate(AnnotatedPipeline pipeline, CiConfig config, PipelineOptions options) {
                // records nothing
            }
        };
    }

    @Test
    void testDefaultsContainGitlabAndAreFrozen() {
        GeneratorRegistry registry = GeneratorRegistry.withDefaults();

        assertThat(registry.platforms()).containsExactly("gitlab");
        assertThat(registry.resolve("gitlab")).isInstanceOf(GitlabPipelineGenerator.class);
        assertThat(registry.isFrozen()).isTrue();
    }

    @Test
    void testRegisterAndResolve() {
        GeneratorRegistry registry = new GeneratorRegistry();
        PipelineGenerator jenkins = named("jenkins");

        registry.register(" jenkins ", jenkins);

        assertThat(registry.resolve("jenkins")).isSameAs(jenkins);
    }

    @Test
    void testDuplicateRegistrationFails() {
        GeneratorRegistry registry = new GeneratorRegistry();
        registry.register("gitlab", named("gitlab"));

        assertThatThrownBy(() -> registry.register("gitlab", named("gitlab")))
                .isInstanceOf(DuplicateGeneratorException.class)
                .hasMessageContaining("gitlab");
    }

    @Test
    void testUnknownPlatformListsKnownOnes() {
        GeneratorRegistry registry = new GeneratorRegistry();
        registry.register("gitlab", named("gitlab"));
        registry.register("buildkite", named("buildkite"));

        assertThatThrownBy(() -> registry.resolve("github"))
                .isInstanceOf(UnknownGeneratorException.class)
                .hasMessageContaining("[buildkite, gitlab]")
                .satisfies(e -> assertThat(((UnknownGeneratorException) e).getKnownPlatforms())
                        .containsExactlyInAnyOrder("gitlab", "buildkite"));
    }

    @Test
    void testFrozenRegistryRejectsRegistration() {
        GeneratorRegistry registry = GeneratorRegistry.withDefaults();

        assertThatThrownBy(() -> registry.register("jenkins", named("jenkins")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBlankPlatformIsRejected() {
        assertThatThrownBy(() -> new GeneratorRegistry().register("  ", named("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
