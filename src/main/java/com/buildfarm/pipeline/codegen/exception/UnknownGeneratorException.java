package com.buildfarm.pipeline.codegen.exception;

import java.util.Set;
import java.util.TreeSet;

public class UnknownGeneratorException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;
    private final String platform;
    private final Set<String> knownPlatforms;

    public UnknownGeneratorException(String platform, Set<String> knownPlatforms) {
        super("No registered generator for platform '" + platform + "'. Known platforms: "
                + new TreeSet<>(knownPlatforms));
        this.platform = platform;
        this.knownPlatforms = Set.copyOf(knownPlatforms);
    }

    public String getPlatform() {
        return platform;
    }

    public Set<String> getKnownPlatforms() {
        return knownPlatforms;
    }
}
