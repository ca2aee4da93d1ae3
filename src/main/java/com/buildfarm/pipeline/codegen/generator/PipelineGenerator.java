package com.buildfarm.pipeline.codegen.generator;

import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;

/**
 * Backend specific transformation of an annotated pipeline into one artifact
 * written at {@link PipelineOptions#getOutputPath()}.
 *
 * Implementations must not mutate their inputs or perform side effects other
 * than writing that artifact, and must emit exactly one job per kept node.
 * {@link JobPlanner} provides the backend neutral dependency and stage plan.
 */
public interface PipelineGenerator {

    /**
     * Platform name this generator is registered under.
     */
    String platform();

    void generate(AnnotatedPipeline pipeline, CiConfig config, PipelineOptions options);
}
