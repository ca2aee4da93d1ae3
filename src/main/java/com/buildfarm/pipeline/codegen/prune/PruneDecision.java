package com.buildfarm.pipeline.codegen.prune;

import lombok.Value;

/**
 * Opinion of one pruning policy about one node, with the reason shown in the
 * pruning summary.
 */
@Value
public class PruneDecision {

    boolean prune;
    String reason;

    public static PruneDecision keep(String reason) {
        return new PruneDecision(false, reason);
    }

    public static PruneDecision prune(String reason) {
        return new PruneDecision(true, reason);
    }
}
