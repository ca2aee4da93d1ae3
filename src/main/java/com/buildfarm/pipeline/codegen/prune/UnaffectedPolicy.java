package com.buildfarm.pipeline.codegen.prune;

import java.util.Set;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * Prunes nodes outside the affected set computed by
 * {@link AffectedSetCalculator}.
 */
public class UnaffectedPolicy implements PruningPolicy {

    private final Set<String> affectedIdentities;

    public UnaffectedPolicy(Set<String> affectedIdentities) {
        this.affectedIdentities = Set.copyOf(affectedIdentities);
    }

    @Override
    public NodeStatus prunedStatus() {
        return NodeStatus.PRUNED_UNAFFECTED;
    }

    @Override
    public PruneDecision evaluate(SpecNode node) {
        if (affectedIdentities.contains(node.getIdentity())) {
            return PruneDecision.keep("affected by change");
        }
        return PruneDecision.prune("unaffected by change");
    }
}
