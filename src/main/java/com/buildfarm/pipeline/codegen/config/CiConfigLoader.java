package com.buildfarm.pipeline.codegen.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.InputFormatException;
import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.config.ConfigRule;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads the CI configuration. The document is either the {@code ci} section
 * itself or a mapping with a top level {@code ci} key.
 *
 * Rules keep their position in the file as declaration index, which breaks
 * specificity ties during attribute resolution.
 */
public class CiConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CiConfigLoader.class);

    static final String ROOT_KEY = "ci";

    private final ObjectMapper mapper;

    public CiConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public CiConfig load(Path path) {
        log.debug("Loading CI configuration from {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new InputFormatException("Cannot read CI configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public CiConfig load(InputStream in, String sourceName) {
        CiConfig parsed;
        try {
            JsonNode root = mapper.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.warn("CI configuration {} is empty, using defaults", sourceName);
                return CiConfig.empty();
            }
            if (!root.isObject()) {
                throw new InputFormatException("CI configuration " + sourceName + " must be a mapping");
            }
            JsonNode section = root.has(ROOT_KEY) ? root.get(ROOT_KEY) : root;
            parsed = mapper.treeToValue(section, CiConfig.class);
        } catch (IOException e) {
            throw new InputFormatException("Invalid CI configuration " + sourceName + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            return CiConfig.empty();
        }

        CiConfig config = indexRules(parsed);
        log.info("Loaded {} pipeline-gen rule(s) for target '{}' from {}",
                config.getRules().size(), config.getTarget(), sourceName);
        return config;
    }

    static CiConfig indexRules(CiConfig config) {
        List<ConfigRule> indexed = new ArrayList<>();
        for (int i = 0; i < config.getRules().size(); i++) {
            indexed.add(config.getRules().get(i).toBuilder().declarationIndex(i).build());
        }
        return config.toBuilder().clearRules().rules(indexed).build();
    }
}
