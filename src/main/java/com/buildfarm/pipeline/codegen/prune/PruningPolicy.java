package com.buildfarm.pipeline.codegen.prune;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * One pruning pass. Implementations must decide from the node and their own
 * externally supplied inputs only, never from the status of other nodes, so a
 * pass can evaluate nodes in parallel.
 */
public interface PruningPolicy {

    /**
     * Status given to nodes this policy prunes.
     */
    NodeStatus prunedStatus();

    PruneDecision evaluate(SpecNode node);
}
