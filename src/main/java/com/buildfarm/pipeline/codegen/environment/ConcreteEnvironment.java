package com.buildfarm.pipeline.codegen.environment;

import java.util.List;
import java.util.Set;

import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Wired specs of one environment plus the caller-supplied pruning flags.
 * Flagged specs are the same objects reachable from {@link #roots}.
 */
@Value
@Builder
public class ConcreteEnvironment {

    @Singular
    List<BuildSpec> roots;

    @Singular("availableSpec")
    List<BuildSpec> availableSpecs;

    @Singular("brokenSpec")
    List<BuildSpec> brokenSpecs;

    @Singular("changedSpec")
    List<BuildSpec> changedSpecs;

    /**
     * Package names whose every concrete spec counts as changed.
     */
    @Singular
    Set<String> changedPackages;
}
