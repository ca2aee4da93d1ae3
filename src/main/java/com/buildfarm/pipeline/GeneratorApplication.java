package com.buildfarm.pipeline;

import com.buildfarm.pipeline.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the CI pipeline generator.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
