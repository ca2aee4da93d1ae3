package com.buildfarm.pipeline.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.cli.model.GenerateOptions;
import com.buildfarm.pipeline.cli.model.ValidatedGenerateOptions;
import com.buildfarm.pipeline.codegen.GeneratorResult;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ValidatedGenerateOptions v, PipelineOptions p) {
        log.info("=================================================");
        log.info("CI Pipeline Generator");
        log.info("=================================================");
        log.info("Environment: {}", v.getEnvironmentPath());
        log.info("CI Configuration: {}", v.getConfigPath() != null ? v.getConfigPath() : "None (defaults)");
        log.info("Platform: {}", p.getPlatform());
        log.info("Output: {}", v.getNormalizedOutputPath());
        log.info("Pipeline Type: {}", p.getPipelineType() != null ? p.getPipelineType() : "None");
        log.info("Stack Name: {}", p.getStackName() != null ? p.getStackName() : "None");
        log.info("-------------------------------------------------");
        log.info("Pruning:");
        log.info("  Broken:     {}", p.isPruneBroken());
        log.info("  Up-to-date: {}", p.isPruneUpToDate());
        log.info("  Externals:  {}", p.isPruneExternal());
        log.info("  Unaffected: {}", p.isAffectedOnly());
        if (p.isAffectedOnly()) {
            log.info("  Dependent Depth: {}",
                    p.getDependentTraverseDepth() != null ? p.getDependentTraverseDepth() : "unlimited");
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        log.info("Generator: {}", result.getPlatform());
        log.info("Graph: {} node(s), {} edge(s)", result.getNodeCount(), result.getEdgeCount());
        log.info("Build Jobs: {}", result.getJobCount());

        if (result.getPrunedCount() > 0) {
            log.info("");
            log.info("Pruned Specs:");
            log.info("  Broken:     {}", result.getPrunedBroken());
            log.info("  Up-to-date: {}", result.getPrunedAvailable());
            log.info("  External:   {}", result.getPrunedExternal());
            log.info("  Unaffected: {}", result.getPrunedUnaffected());
        }
        if (result.getJobCount() == 0) {
            log.info("");
            log.info("Nothing to rebuild; the pipeline contains a single no-op job.");
        }
        if (!o.isSummary()) {
            log.info("");
            log.info("Run with --summary to list every rebuilt and pruned spec.");
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
