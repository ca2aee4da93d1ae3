package com.buildfarm.pipeline.codegen.prune;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;

import lombok.Value;

/**
 * Computes every node a change could have affected: the changed nodes, their
 * dependents (optionally up to a depth), and the dependency closure of all of
 * those.
 */
public class AffectedSetCalculator {
    private static final Logger log = LoggerFactory.getLogger(AffectedSetCalculator.class);

    /**
     * @param dependentDepth {@code null} for no limit, {@code 0} or less for the
     *                       changed nodes only
     */
    public Set<String> compute(PipelineGraph graph, Collection<String> changed, Integer dependentDepth) {
        Set<String> affected = new TreeSet<>();
        Integer depthLimit = dependentDepth == null ? null : Math.max(dependentDepth, 0);

        Set<String> reached = new HashSet<>();
        Deque<Step> queue = new ArrayDeque<>();
        for (String id : new TreeSet<>(changed)) {
            if (!graph.contains(id)) {
                log.warn("Changed spec {} is not part of the pipeline graph, ignoring it", id);
                continue;
            }
            if (reached.add(id)) {
                queue.add(new Step(id, 0));
            }
        }

        // breadth first upwards, so each node is reached at its smallest depth
        while (!queue.isEmpty()) {
            Step step = queue.poll();
            if (!affected.contains(step.getIdentity())) {
                affected.addAll(graph.dependencyClosure(step.getIdentity()));
            }
            if (depthLimit != null && step.getDepth() >= depthLimit) {
                continue;
            }
            for (String parent : graph.dependents(step.getIdentity())) {
                if (reached.add(parent)) {
                    queue.add(new Step(parent, step.getDepth() + 1));
                }
            }
        }

        log.debug("Affected set: {} of {} nodes (dependent depth {})",
                affected.size(), graph.size(), dependentDepth == null ? "unlimited" : dependentDepth);
        return affected;
    }

    @Value
    private static class Step {
        String identity;
        int depth;
    }
}
