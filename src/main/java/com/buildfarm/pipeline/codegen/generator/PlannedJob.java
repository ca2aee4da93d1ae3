package com.buildfarm.pipeline.codegen.generator;

import java.util.List;

import com.buildfarm.pipeline.codegen.model.config.JobAttributes;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

import lombok.Builder;
import lombok.Value;

/**
 * One job of the backend neutral plan.
 */
@Value
@Builder
public class PlannedJob {

    SpecNode node;

    JobAttributes attributes;

    /**
     * Zero based stage. Strictly greater than the stage of every job in
     * {@link #needs}.
     */
    int stage;

    /**
     * Identities of the nearest kept dependencies, sorted.
     */
    List<String> needs;

    public String identity() {
        return node.getIdentity();
    }
}
