package com.buildfarm.pipeline.codegen.attributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.MissingRequiredAttributeException;
import com.buildfarm.pipeline.codegen.model.config.ConfigRule;
import com.buildfarm.pipeline.codegen.model.config.JobAttributePatch;
import com.buildfarm.pipeline.codegen.model.config.JobAttributes;
import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.buildfarm.pipeline.codegen.prune.PruningResult;

/**
 * Merges configuration rules into one {@link JobAttributes} per kept node.
 *
 * Rules are sorted once by {@link ConfigRule#PRECEDENCE}. For a node every
 * matching rule is applied in that order, field by field, so the most specific
 * and then most recently declared rule wins. Lists and scalars are replaced;
 * variables are merged key by key.
 */
public class AttributeResolver {
    private static final Logger log = LoggerFactory.getLogger(AttributeResolver.class);

    public static final String FIELD_TAGS = "tags";
    public static final String FIELD_STAGE_HINT = "stage-hint";

    public static final String VAR_SPEC_HASH = "PIPELINE_SPEC_HASH";
    public static final String VAR_SPEC_NAME = "PIPELINE_SPEC_NAME";
    public static final String VAR_SPEC_VERSION = "PIPELINE_SPEC_VERSION";
    public static final String VAR_SPEC_COMPILER = "PIPELINE_SPEC_COMPILER";
    public static final String VAR_SPEC_PLATFORM = "PIPELINE_SPEC_PLATFORM";
    public static final String VAR_SPEC_VARIANTS = "PIPELINE_SPEC_VARIANTS";

    private final List<ConfigRule> orderedRules;

    public AttributeResolver(List<ConfigRule> rules) {
        List<ConfigRule> sorted = new ArrayList<>(rules);
        sorted.sort(ConfigRule.PRECEDENCE);
        this.orderedRules = Collections.unmodifiableList(sorted);
    }

    /**
     * Resolves every kept node. Nodes are independent, so they are merged on a
     * parallel stream; failures are reported for the first offending node in
     * identity order.
     *
     * @return attributes keyed by identity, sorted
     */
    public Map<String, JobAttributes> resolveAll(PipelineGraph graph, PruningResult pruning) {
        Map<String, Resolution> resolutions = graph.nodes().parallelStream()
                .filter(node -> pruning.isKept(node.getIdentity()))
                .collect(Collectors.toConcurrentMap(SpecNode::getIdentity, this::merge));

        Map<String, JobAttributes> resolved = new TreeMap<>();
        for (Map.Entry<String, Resolution> entry : new TreeMap<>(resolutions).entrySet()) {
            resolved.put(entry.getKey(), entry.getValue().toAttributes());
        }
        log.info("Resolved job attributes for {} node(s) from {} rule(s)", resolved.size(), orderedRules.size());
        return Collections.unmodifiableMap(resolved);
    }

    public JobAttributes resolve(SpecNode node) {
        return merge(node).toAttributes();
    }

    public List<ConfigRule> orderedRules() {
        return orderedRules;
    }

    private Resolution merge(SpecNode node) {
        Resolution state = new Resolution(node);
        state.variables.put(VAR_SPEC_HASH, node.getIdentity());
        state.variables.put(VAR_SPEC_NAME, node.getName());
        state.variables.put(VAR_SPEC_VERSION, nullToEmpty(node.getVersion()));
        state.variables.put(VAR_SPEC_COMPILER, nullToEmpty(node.getCompiler()));
        state.variables.put(VAR_SPEC_PLATFORM, nullToEmpty(node.getPlatform()));
        state.variables.put(VAR_SPEC_VARIANTS, node.formatVariants());

        for (ConfigRule rule : orderedRules) {
            if (rule.matches(node)) {
                state.apply(rule.getAttributes());
            }
        }
        return state;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Mutable merge state, confined to the thread resolving one node.
     */
    private static final class Resolution {
        private final SpecNode node;
        private List<String> tags;
        private final Map<String, String> variables = new TreeMap<>();
        private Integer stageHint;
        private Boolean allowFailure;
        private String image;
        private List<String> script;
        private List<String> beforeScript;
        private List<String> afterScript;
        private String timeout;

        Resolution(SpecNode node) {
            this.node = node;
        }

        void apply(JobAttributePatch patch) {
            if (patch.getTags() != null) {
                tags = new ArrayList<>(new LinkedHashSet<>(patch.getTags()));
            }
            if (patch.getVariables() != null) {
                variables.putAll(patch.getVariables());
            }
            if (patch.getStageHint() != null) {
                stageHint = patch.getStageHint();
            }
            if (patch.getAllowFailure() != null) {
                allowFailure = patch.getAllowFailure();
            }
            if (patch.getImage() != null) {
                image = patch.getImage();
            }
            if (patch.getScript() != null) {
                script = List.copyOf(patch.getScript());
            }
            if (patch.getBeforeScript() != null) {
                beforeScript = List.copyOf(patch.getBeforeScript());
            }
            if (patch.getAfterScript() != null) {
                afterScript = List.copyOf(patch.getAfterScript());
            }
            if (patch.getTimeout() != null) {
                timeout = patch.getTimeout();
            }
        }

        JobAttributes toAttributes() {
            List<String> missing = new ArrayList<>();
            if (tags == null || tags.isEmpty()) {
                missing.add(FIELD_TAGS);
            }
            if (stageHint == null || stageHint < 0) {
                missing.add(FIELD_STAGE_HINT);
            }
            if (!missing.isEmpty()) {
                throw new MissingRequiredAttributeException(node.getIdentity(), node.describe(), missing);
            }

            JobAttributes.JobAttributesBuilder builder = JobAttributes.builder()
                    .tags(tags)
                    .variables(variables)
                    .stageHint(stageHint)
                    .allowFailure(Boolean.TRUE.equals(allowFailure))
                    .image(image)
                    .timeout(timeout);
            if (script != null) {
                builder.script(script);
            }
            if (beforeScript != null) {
                builder.beforeScript(beforeScript);
            }
            if (afterScript != null) {
                builder.afterScript(afterScript);
            }
            return builder.build();
        }
    }
}
