package com.buildfarm.pipeline.codegen.model.core.context;

import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Signals supplied from outside the core, keyed by node identity: the build
 * cache index, the known-broken list and the change set.
 */
@Value
@Builder
public class PruningInputs {

    @Singular("broken")
    Set<String> brokenIdentities;

    @Singular("available")
    Set<String> availableIdentities;

    @Singular("changed")
    Set<String> changedIdentities;

    public static PruningInputs none() {
        return PruningInputs.builder().build();
    }
}
