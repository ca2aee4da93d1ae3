package com.buildfarm.pipeline.codegen.exception;

import java.io.IOException;
import java.nio.file.Path;

public class OutputWriteException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;
    private final transient Path target;

    public OutputWriteException(Path target, IOException cause) {
        super("Failed to write pipeline to " + target + ": " + cause.getMessage(), cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
