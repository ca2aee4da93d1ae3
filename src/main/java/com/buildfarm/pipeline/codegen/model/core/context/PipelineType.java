package com.buildfarm.pipeline.codegen.model.core.context;

/**
 * Kind of pipeline being generated. Drives reserved runner tags.
 */
public enum PipelineType {
    PROTECTED_BRANCH,
    PULL_REQUEST
}
