package com.buildfarm.pipeline.codegen.model.core.context;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Options of one generation run. Immutable for the duration of the run.
 */
@Value
@Builder(toBuilder = true)
public class PipelineOptions {

    /**
     * Name of the generator to resolve from the registry.
     */
    @NonNull
    @Builder.Default
    String platform = "gitlab";

    /**
     * Destination of the generated pipeline file.
     */
    @NonNull
    Path outputPath;

    boolean pruneUpToDate;

    boolean pruneBroken;

    @Builder.Default
    boolean pruneExternal = true;

    boolean affectedOnly;

    /**
     * How far to walk up from changed specs when computing the affected set.
     * {@code null} walks to the roots, {@code 0} keeps only the changed specs
     * and negative values are treated as {@code 0}.
     */
    Integer dependentTraverseDepth;

    PipelineType pipelineType;

    String stackName;

    @NonNull
    @Builder.Default
    String artifactsRoot = "jobs_scratch_dir";

    @Builder.Default
    boolean rebuildIndex = true;

    boolean printSummary;

    public boolean isRebuildEverything() {
        return !pruneUpToDate && !affectedOnly;
    }
}
