package com.buildfarm.pipeline.codegen.prune;

import java.util.Set;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * Prunes specs the build cache already holds. Dependents only need the
 * identity of such a spec, not a rebuild job.
 */
public class AlreadyAvailablePolicy implements PruningPolicy {

    private final Set<String> availableIdentities;

    public AlreadyAvailablePolicy(Set<String> availableIdentities) {
        this.availableIdentities = Set.copyOf(availableIdentities);
    }

    @Override
    public NodeStatus prunedStatus() {
        return NodeStatus.PRUNED_AVAILABLE;
    }

    @Override
    public PruneDecision evaluate(SpecNode node) {
        if (availableIdentities.contains(node.getIdentity())) {
            return PruneDecision.prune("up-to-date in build cache");
        }
        return PruneDecision.keep("not found in build cache");
    }
}
