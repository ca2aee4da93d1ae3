package com.buildfarm.pipeline.codegen.exception;

public class DuplicateGeneratorException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;
    private final String platform;

    public DuplicateGeneratorException(String platform) {
        super("A generator is already registered for platform '" + platform + "'");
        this.platform = platform;
    }

    public String getPlatform() {
        return platform;
    }
}
