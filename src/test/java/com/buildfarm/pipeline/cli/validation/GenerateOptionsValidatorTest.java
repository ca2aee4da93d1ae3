package com.buildfarm.pipeline.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.buildfarm.pipeline.cli.exception.OptionsValidationException;
import com.buildfarm.pipeline.cli.model.GenerateOptions;
import com.buildfarm.pipeline.cli.model.ValidatedGenerateOptions;

import picocli.CommandLine;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    private Path environment;

    @BeforeEach
    void setUp() throws IOException {
        environment = Files.writeString(tempDir.resolve("env.yaml"), "specs: []\n");
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptions() {
        GenerateOptions options = parse("-e", environment.toString(), "-o", tempDir.resolve("out.yml").toString());

        ValidatedGenerateOptions validated = validator.validate(options);

        assertThat(validated.getEnvironmentPath()).isEqualTo(environment.toAbsolutePath().normalize());
        assertThat(validated.getConfigPath()).isNull();
        assertThat(validated.getNormalizedOutputPath()).isEqualTo(tempDir.resolve("out.yml").toAbsolutePath());
        assertThat(options.isPruneExternals()).isTrue();
        assertThat(options.getArtifactsRoot()).isEqualTo("jobs_scratch_dir");
    }

    @Test
    void testNegatedExternalsAndEnumParsing() {
        GenerateOptions options = parse("-e", environment.toString(), "--no-prune-externals",
                "--pipeline-type", "pull_request");

        assertThat(options.isPruneExternals()).isFalse();
        assertThat(options.getPipelineType().name()).isEqualTo("PULL_REQUEST");
    }

    @Test
    void testCollectsAllErrors() {
        GenerateOptions options = parse(
                "-e", tempDir.resolve("missing.yaml").toString(),
                "-c", tempDir.resolve("missing-ci.yaml").toString(),
                "-o", tempDir.toString(),
                "--dependent-depth", "-2");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(5)
                        .anySatisfy(msg -> assertThat(msg).contains("Environment document does not exist"))
                        .anySatisfy(msg -> assertThat(msg).contains("CI configuration does not exist"))
                        .anySatisfy(msg -> assertThat(msg).contains("Output path is a directory"))
                        .anySatisfy(msg -> assertThat(msg).contains("Dependent depth must be >= 0"))
                        .anySatisfy(msg -> assertThat(msg).contains("only applies together with --affected-only")));
    }

    @Test
    void testDependentDepthWithAffectedOnly() {
        GenerateOptions options = parse("-e", environment.toString(), "--affected-only", "--dependent-depth", "1");

        assertThatCode(() -> validator.validate(options)).doesNotThrowAnyException();
    }
}
