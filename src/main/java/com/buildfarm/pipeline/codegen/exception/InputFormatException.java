package com.buildfarm.pipeline.codegen.exception;

/**
 * An environment or CI configuration document could not be read or is
 * structurally invalid.
 */
public class InputFormatException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
