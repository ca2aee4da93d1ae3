package com.buildfarm.pipeline.codegen.exception;

/**
 * Base type for every failure of a generation run. Runs are deterministic, so
 * none of these are retried internally.
 */
public class PipelineGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineGenerationException(String message) {
        super(message);
    }

    public PipelineGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
