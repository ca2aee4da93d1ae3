package com.buildfarm.pipeline.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one pipeline generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private String platform;

    private int nodeCount;
    private int edgeCount;
    private int jobCount;

    private long prunedBroken;
    private long prunedAvailable;
    private long prunedExternal;
    private long prunedUnaffected;

    public long getPrunedCount() {
        return prunedBroken + prunedAvailable + prunedExternal + prunedUnaffected;
    }

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
