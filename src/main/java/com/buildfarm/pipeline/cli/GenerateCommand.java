package com.buildfarm.pipeline.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.cli.exception.OptionsValidationException;
import com.buildfarm.pipeline.cli.model.GenerateOptions;
import com.buildfarm.pipeline.cli.model.ValidatedGenerateOptions;
import com.buildfarm.pipeline.cli.output.GenerateResultsPrinter;
import com.buildfarm.pipeline.cli.validation.GenerateOptionsValidator;
import com.buildfarm.pipeline.codegen.GeneratorResult;
import com.buildfarm.pipeline.codegen.PipelineGenerationService;
import com.buildfarm.pipeline.codegen.config.CiConfigLoader;
import com.buildfarm.pipeline.codegen.environment.ConcreteEnvironment;
import com.buildfarm.pipeline.codegen.environment.EnvironmentLoader;
import com.buildfarm.pipeline.codegen.exception.InputFormatException;
import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating a CI pipeline for a concrete environment.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "ci-pipeline-generator 1.0.0",
        description = "Generates a CI pipeline with one job per spec that needs rebuilding."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator;
    private final GenerateResultsPrinter printer;
    private final PipelineGenerationService service;

    public GenerateCommand() {
        this(new PipelineGenerationService());
    }

    public GenerateCommand(PipelineGenerationService service) {
        this.validator = new GenerateOptionsValidator();
        this.printer = new GenerateResultsPrinter();
        this.service = service;
    }

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        ConcreteEnvironment environment;
        CiConfig config;
        try {
            environment = new EnvironmentLoader().load(validated.getEnvironmentPath());
            config = validated.getConfigPath() == null
                    ? CiConfig.empty()
                    : new CiConfigLoader().load(validated.getConfigPath());
        } catch (InputFormatException e) {
            log.error(e.getMessage());
            return 1;
        }

        PipelineOptions pipelineOptions = toPipelineOptions(validated, config);
        printer.printBanner(validated, pipelineOptions);

        GeneratorResult result = service.generate(environment, config, pipelineOptions);
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(options, result);
        return 0;
    }

    PipelineOptions toPipelineOptions(ValidatedGenerateOptions validated, CiConfig config) {
        return PipelineOptions.builder()
                .platform(options.getPlatform() != null ? options.getPlatform().trim() : config.getTarget())
                .outputPath(validated.getNormalizedOutputPath())
                .pruneUpToDate(options.isPruneUpToDate())
                .pruneBroken(options.isPruneBroken())
                .pruneExternal(options.isPruneExternals())
                .affectedOnly(options.isAffectedOnly())
                .dependentTraverseDepth(options.getDependentDepth())
                .pipelineType(options.getPipelineType())
                .stackName(options.getStackName())
                .artifactsRoot(options.getArtifactsRoot())
                .rebuildIndex(!options.isNoRebuildIndex())
                .printSummary(options.isSummary())
                .build();
    }
}
