package com.buildfarm.pipeline.codegen.generator;

import java.util.Map;
import java.util.Set;

import com.buildfarm.pipeline.codegen.model.config.JobAttributes;
import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.prune.PruningResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Pruned and annotated pipeline handed to a generator.
 */
@Value
@Builder(toBuilder = true)
public class AnnotatedPipeline {

    @NonNull
    PipelineGraph graph;

    @NonNull
    PruningResult pruning;

    /**
     * Attributes of every kept node, keyed by identity.
     */
    @NonNull
    Map<String, JobAttributes> attributes;

    /**
     * Identities already present in the build cache. Only informs the
     * generated jobs; pruning has already happened.
     */
    @NonNull
    @Builder.Default
    Set<String> cachedIdentities = Set.of();

    public boolean isCached(String identity) {
        return cachedIdentities.contains(identity);
    }

    public JobAttributes attributesOf(String identity) {
        JobAttributes attrs = attributes.get(identity);
        if (attrs == null) {
            throw new IllegalArgumentException("No job attributes for " + identity);
        }
        return attrs;
    }
}
