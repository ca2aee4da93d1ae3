package com.buildfarm.pipeline.codegen.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.buildfarm.pipeline.codegen.prune.PruningResult;

/**
 * Turns an annotated pipeline into a list of jobs with their dependencies and
 * stages.
 *
 * A job needs the nearest kept nodes below it: pruned dependencies are walked
 * through until a kept node (or a leaf) is found. A job's stage is
 * {@code max(stageHint, 1 + max(stage of needs))}, so jobs only ever depend on
 * earlier stages.
 */
public class JobPlanner {

    private static final Comparator<PlannedJob> JOB_ORDER = Comparator.comparingInt(PlannedJob::getStage)
            .thenComparing(job -> job.getNode().getName())
            .thenComparing(PlannedJob::identity);

    public List<PlannedJob> plan(AnnotatedPipeline pipeline) {
        PipelineGraph graph = pipeline.getGraph();
        PruningResult pruning = pipeline.getPruning();

        Map<String, List<String>> needs = new HashMap<>();
        for (String id : pruning.kept()) {
            needs.put(id, nearestKeptDependencies(graph, pruning, id));
        }

        // dependencies come last in topological order, so walk it backwards
        List<SpecNode> order = new ArrayList<>(graph.topologicalOrder());
        Collections.reverse(order);

        Map<String, Integer> stages = new HashMap<>();
        List<PlannedJob> jobs = new ArrayList<>();
        for (SpecNode node : order) {
            String id = node.getIdentity();
            if (!pruning.isKept(id)) {
                continue;
            }
            int stage = pipeline.attributesOf(id).getStageHint();
            for (String dep : needs.get(id)) {
                stage = Math.max(stage, stages.get(dep) + 1);
            }
            stages.put(id, stage);
            jobs.add(PlannedJob.builder()
                    .node(node)
                    .attributes(pipeline.attributesOf(id))
                    .stage(stage)
                    .needs(needs.get(id))
                    .build());
        }
        jobs.sort(JOB_ORDER);
        return jobs;
    }

    /**
     * Nearest kept nodes reachable from {@code identity} through pruned
     * intermediates only.
     */
    static List<String> nearestKeptDependencies(PipelineGraph graph, PruningResult pruning, String identity) {
        Set<String> found = new TreeSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(graph.dependencies(identity));
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (pruning.isKept(current)) {
                found.add(current);
            } else {
                graph.dependencies(current).forEach(pending::push);
            }
        }
        return List.copyOf(found);
    }
}
