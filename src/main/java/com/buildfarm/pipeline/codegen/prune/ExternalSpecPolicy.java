package com.buildfarm.pipeline.codegen.prune;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

public class ExternalSpecPolicy implements PruningPolicy {

    @Override
    public NodeStatus prunedStatus() {
        return NodeStatus.PRUNED_EXTERNAL;
    }

    @Override
    public PruneDecision evaluate(SpecNode node) {
        return node.isExternal() ? PruneDecision.prune("external spec") : PruneDecision.keep("not external");
    }
}
