package com.buildfarm.pipeline.codegen.generator;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.DuplicateGeneratorException;
import com.buildfarm.pipeline.codegen.exception.UnknownGeneratorException;
import com.buildfarm.pipeline.codegen.generator.gitlab.GitlabPipelineGenerator;

/**
 * Table of pipeline generators by platform name.
 *
 * Populated by explicit {@link #register} calls during start-up, then frozen.
 * Lookups are safe from any thread. Holds no per-run state.
 */
public final class GeneratorRegistry {
    private static final Logger log = LoggerFactory.getLogger(GeneratorRegistry.class);

    private final Map<String, PipelineGenerator> generators = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    /**
     * Registry with the bundled generators registered and frozen.
     */
    public static GeneratorRegistry withDefaults() {
        GeneratorRegistry registry = new GeneratorRegistry();
        registry.register(GitlabPipelineGenerator.PLATFORM, new GitlabPipelineGenerator());
        registry.freeze();
        return registry;
    }

    /**
     * @throws DuplicateGeneratorException if the platform is already taken
     * @throws IllegalStateException       if the registry is frozen
     */
    public void register(String platform, PipelineGenerator generator) {
        Objects.requireNonNull(generator, "generator");
        String key = normalize(platform);
        if (frozen) {
            throw new IllegalStateException("Generator registry is frozen; cannot register " + key);
        }
        if (generators.putIfAbsent(key, generator) != null) {
            throw new DuplicateGeneratorException(key);
        }
        log.debug("Registered generator {} for platform {}", generator.getClass().getSimpleName(), key);
    }

    /**
     * @throws UnknownGeneratorException if nothing is registered for the platform
     */
    public PipelineGenerator resolve(String platform) {
        String key = platform == null ? "" : platform.trim();
        PipelineGenerator generator = generators.get(key);
        if (generator == null) {
            throw new UnknownGeneratorException(key, platforms());
        }
        return generator;
    }

    public Set<String> platforms() {
        return new TreeSet<>(generators.keySet());
    }

    /**
     * Makes the registry read-only.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private static String normalize(String platform) {
        String key = Objects.requireNonNull(platform, "platform").trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Platform name must be non-blank");
        }
        return key;
    }
}
