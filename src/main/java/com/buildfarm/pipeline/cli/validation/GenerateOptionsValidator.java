package com.buildfarm.pipeline.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.buildfarm.pipeline.cli.exception.OptionsValidationException;
import com.buildfarm.pipeline.cli.model.GenerateOptions;
import com.buildfarm.pipeline.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path environment = null;
		if (o.getEnvironment() == null) {
			errors.add("Environment document is required (--environment / -e).");
		} else if (!existsFile(o.getEnvironment())) {
			errors.add("Environment document does not exist or is not a file: " + o.getEnvironment());
		} else {
			environment = o.getEnvironment().toAbsolutePath().normalize();
		}

		Path config = null;
		if (o.getConfig() != null) {
			if (!existsFile(o.getConfig())) {
				errors.add("CI configuration does not exist or is not a file: " + o.getConfig());
			} else {
				config = o.getConfig().toAbsolutePath().normalize();
			}
		}

		if (o.getPlatform() != null && isBlank(o.getPlatform())) {
			errors.add("Platform must not be blank (--platform / -p).");
		}

		if (o.getDependentDepth() != null && o.getDependentDepth() < 0) {
			errors.add("Dependent depth must be >= 0. Got: " + o.getDependentDepth());
		}
		if (o.getDependentDepth() != null && !o.isAffectedOnly()) {
			errors.add("--dependent-depth only applies together with --affected-only.");
		}

		if (isBlank(o.getArtifactsRoot())) {
			errors.add("Artifacts root must not be blank (--artifacts-root).");
		}

		Path output = (o.getOutput() == null ? Path.of(".gitlab-ci.yml") : o.getOutput()).toAbsolutePath()
				.normalize();
		if (Files.isDirectory(output)) {
			errors.add("Output path is a directory: " + output);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(environment, config, output);
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
