package com.buildfarm.pipeline.codegen.environment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.InputFormatException;
import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a concrete environment document (YAML, or JSON as its subset) and
 * wires its entries into {@link BuildSpec} objects.
 *
 * Without an explicit {@code roots} list every entry that no other entry
 * depends on is a root.
 */
public class EnvironmentLoader {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentLoader.class);

    private final ObjectMapper mapper;

    public EnvironmentLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public ConcreteEnvironment load(Path path) {
        log.debug("Loading environment from {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new InputFormatException("Cannot read environment " + path + ": " + e.getMessage(), e);
        }
    }

    public ConcreteEnvironment load(InputStream in, String sourceName) {
        EnvironmentDocument document;
        try {
            document = mapper.readValue(in, EnvironmentDocument.class);
        } catch (IOException e) {
            throw new InputFormatException("Invalid environment document " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new InputFormatException("Environment document " + sourceName + " is empty");
        }
        return toEnvironment(document, sourceName);
    }

    ConcreteEnvironment toEnvironment(EnvironmentDocument document, String sourceName) {
        Map<String, BuildSpec> byId = new LinkedHashMap<>();
        for (SpecEntry entry : document.getSpecs()) {
            if (entry.getId() == null || entry.getId().isBlank()) {
                throw new InputFormatException(sourceName + ": spec entry without id");
            }
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new InputFormatException(sourceName + ": spec " + entry.getId() + " has no name");
            }
            if (byId.putIfAbsent(entry.getId(), toSpec(entry)) != null) {
                throw new InputFormatException(sourceName + ": duplicate spec id " + entry.getId());
            }
        }

        Set<String> referenced = new HashSet<>();
        for (SpecEntry entry : document.getSpecs()) {
            if (entry.getDependencies() == null) {
                continue;
            }
            BuildSpec spec = byId.get(entry.getId());
            for (String depId : entry.getDependencies()) {
                spec.dependsOn(lookup(byId, depId, sourceName, "dependency of " + entry.getId()));
                referenced.add(depId);
            }
        }

        ConcreteEnvironment.ConcreteEnvironmentBuilder env = ConcreteEnvironment.builder();
        if (document.getRoots().isEmpty()) {
            byId.forEach((id, spec) -> {
                if (!referenced.contains(id)) {
                    env.root(spec);
                }
            });
        } else {
            for (String id : document.getRoots()) {
                env.root(lookup(byId, id, sourceName, "root"));
            }
        }
        for (String id : document.getAvailableIds()) {
            env.availableSpec(lookup(byId, id, sourceName, "available entry"));
        }
        for (String id : document.getBrokenIds()) {
            env.brokenSpec(lookup(byId, id, sourceName, "broken entry"));
        }
        for (String id : document.getChangedIds()) {
            env.changedSpec(lookup(byId, id, sourceName, "changed entry"));
        }
        env.changedPackages(document.getChangedPackages());

        ConcreteEnvironment environment = env.build();
        log.info("Loaded {} spec(s), {} root(s) from {}", byId.size(), environment.getRoots().size(), sourceName);
        return environment;
    }

    private static BuildSpec toSpec(SpecEntry entry) {
        Map<String, String> variants = new TreeMap<>();
        if (entry.getVariants() != null) {
            // "debug:" with no value reads as null; treat it as an empty value
            entry.getVariants().forEach((k, v) -> variants.put(k, v == null ? "" : v));
        }
        return BuildSpec.builder()
                .name(entry.getName())
                .version(entry.getVersion())
                .variants(variants)
                .compiler(entry.getCompiler())
                .platform(entry.getPlatform())
                .external(entry.isExternal())
                .dependencies(new ArrayList<>())
                .build();
    }

    private static BuildSpec lookup(Map<String, BuildSpec> byId, String id, String sourceName, String role) {
        BuildSpec spec = byId.get(id);
        if (spec == null) {
            throw new InputFormatException(sourceName + ": unknown spec id '" + id + "' used as " + role);
        }
        return spec;
    }
}
