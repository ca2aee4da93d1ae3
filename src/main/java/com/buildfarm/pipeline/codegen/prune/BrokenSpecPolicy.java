package com.buildfarm.pipeline.codegen.prune;

import java.util.Set;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

public class BrokenSpecPolicy implements PruningPolicy {

    private final Set<String> brokenIdentities;

    public BrokenSpecPolicy(Set<String> brokenIdentities) {
        this.brokenIdentities = Set.copyOf(brokenIdentities);
    }

    @Override
    public NodeStatus prunedStatus() {
        return NodeStatus.PRUNED_BROKEN;
    }

    @Override
    public PruneDecision evaluate(SpecNode node) {
        if (brokenIdentities.contains(node.getIdentity())) {
            return PruneDecision.prune("known broken");
        }
        return PruneDecision.keep("not known broken");
    }
}
