package com.buildfarm.pipeline.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path environmentPath;
    /** {@code null} when no CI configuration was given. */
    Path configPath;
    Path normalizedOutputPath;
}
