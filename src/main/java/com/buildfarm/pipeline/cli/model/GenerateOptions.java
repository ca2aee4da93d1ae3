package com.buildfarm.pipeline.cli.model;

import java.nio.file.Path;

import com.buildfarm.pipeline.codegen.model.core.context.PipelineType;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--environment", "-e" }, required = true,
			description = "Concrete environment document (YAML or JSON)")
	private Path environment;

	@Option(names = { "--config", "-c" }, description = "CI configuration with the pipeline-gen rules (YAML)")
	private Path config;

	@Option(names = { "--output", "-o" }, defaultValue = ".gitlab-ci.yml",
			description = "Path of the generated pipeline file (default: ${DEFAULT-VALUE})")
	private Path output;

	@Option(names = { "--platform", "-p" },
			description = "Generator to use; overrides the target of the CI configuration")
	private String platform;

	@Option(names = { "--prune-up-to-date" }, description = "Skip specs already present in the build cache")
	private boolean pruneUpToDate;

	@Option(names = { "--prune-broken" }, description = "Skip specs known to be broken")
	private boolean pruneBroken;

	@Option(names = { "--prune-externals" }, negatable = true, defaultValue = "true",
			description = "Skip specs provided by the host system (default: ${DEFAULT-VALUE})")
	private boolean pruneExternals;

	@Option(names = { "--affected-only" }, description = "Only rebuild specs affected by the change set")
	private boolean affectedOnly;

	@Option(names = { "--dependent-depth" },
			description = "How many levels of dependents of a changed spec count as affected (default: all)")
	private Integer dependentDepth;

	@Option(names = { "--pipeline-type" },
			description = "PROTECTED_BRANCH or PULL_REQUEST; adjusts the runner tags")
	private PipelineType pipelineType;

	@Option(names = { "--stack-name" }, description = "Name of the software stack, exported to every job")
	private String stackName;

	@Option(names = { "--artifacts-root" }, defaultValue = "jobs_scratch_dir",
			description = "Directory jobs collect their artifacts in (default: ${DEFAULT-VALUE})")
	private String artifactsRoot;

	@Option(names = { "--no-rebuild-index" }, description = "Do not add the final rebuild-index job")
	private boolean noRebuildIndex;

	@Option(names = { "--summary" }, description = "Log the rebuild and prune lists")
	private boolean summary;

}
