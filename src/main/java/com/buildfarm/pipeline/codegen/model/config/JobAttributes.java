package com.buildfarm.pipeline.codegen.model.config;

import java.util.List;
import java.util.SortedMap;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Final attribute set of one job, produced by merging rules. Never mutated
 * after creation.
 */
@Value
@Builder(toBuilder = true)
public class JobAttributes {

    /**
     * Runner tags in declaration order, without duplicates.
     */
    @Singular
    List<String> tags;

    @Singular
    SortedMap<String, String> variables;

    /**
     * Lowest stage the job may be placed in.
     */
    int stageHint;

    boolean allowFailure;

    String image;

    @Singular("scriptLine")
    List<String> script;

    @Singular("beforeScriptLine")
    List<String> beforeScript;

    @Singular("afterScriptLine")
    List<String> afterScript;

    String timeout;
}
