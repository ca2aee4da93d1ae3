package com.buildfarm.pipeline.codegen.prune;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;
import com.buildfarm.pipeline.codegen.model.core.context.PruningInputs;
import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * Marks nodes that do not need a job of their own.
 *
 * Policies run one after the other in a fixed order: broken, already
 * available, external, unaffected. The first policy that prunes a node decides
 * its status and later policies skip it. The graph itself is never touched:
 * nodes and edges stay in place and only the returned statuses change.
 */
public class Pruner {
    private static final Logger log = LoggerFactory.getLogger(Pruner.class);

    private final AffectedSetCalculator affectedSetCalculator;

    public Pruner() {
        this(new AffectedSetCalculator());
    }

    public Pruner(AffectedSetCalculator affectedSetCalculator) {
        this.affectedSetCalculator = affectedSetCalculator;
    }

    public PruningResult prune(PipelineGraph graph, PipelineOptions options, PruningInputs inputs) {
        return prune(graph, options, inputs, null);
    }

    /**
     * Prunes starting from an earlier result; statuses already pruned there are
     * terminal and carried over unchanged.
     */
    public PruningResult prune(PipelineGraph graph, PipelineOptions options, PruningInputs inputs,
                               PruningResult previous) {
        Map<String, NodeStatus> statuses = new TreeMap<>();
        Map<String, String> pruneReasons = new HashMap<>();
        Map<String, List<String>> keepReasons = new HashMap<>();

        for (SpecNode node : graph.nodes()) {
            String id = node.getIdentity();
            if (previous != null && previous.contains(id) && previous.status(id).isPruned()) {
                statuses.put(id, previous.status(id));
                pruneReasons.put(id, previous.reason(id));
            } else {
                statuses.put(id, NodeStatus.KEEP);
                keepReasons.put(id, new ArrayList<>());
            }
        }

        for (PruningPolicy policy : enabledPolicies(graph, options, inputs)) {
            Map<String, PruneDecision> decisions = graph.nodes().parallelStream()
                    .filter(node -> statuses.get(node.getIdentity()) == NodeStatus.KEEP)
                    .collect(Collectors.toMap(SpecNode::getIdentity, policy::evaluate));

            int prunedInPass = 0;
            for (Map.Entry<String, PruneDecision> entry : new TreeMap<>(decisions).entrySet()) {
                PruneDecision decision = entry.getValue();
                if (decision.isPrune()) {
                    statuses.put(entry.getKey(), policy.prunedStatus());
                    pruneReasons.put(entry.getKey(), decision.getReason());
                    keepReasons.remove(entry.getKey());
                    prunedInPass++;
                } else {
                    keepReasons.get(entry.getKey()).add(decision.getReason());
                }
            }
            log.debug("{} pass pruned {} node(s)", policy.getClass().getSimpleName(), prunedInPass);
        }

        Map<String, String> reasons = new HashMap<>(pruneReasons);
        keepReasons.forEach((id, list) -> reasons.put(id, list.isEmpty() ? "rebuild" : String.join(", ", list)));

        PruningResult result = new PruningResult(statuses, reasons);
        log.info("Pruning complete: {} of {} node(s) kept", result.kept().size(), graph.size());
        if (options.isPrintSummary()) {
            logSummary(graph, result);
        }
        return result;
    }

    List<PruningPolicy> enabledPolicies(PipelineGraph graph, PipelineOptions options, PruningInputs inputs) {
        List<PruningPolicy> policies = new ArrayList<>();
        if (options.isPruneBroken()) {
            policies.add(new BrokenSpecPolicy(inputs.getBrokenIdentities()));
        }
        if (options.isPruneUpToDate()) {
            policies.add(new AlreadyAvailablePolicy(inputs.getAvailableIdentities()));
        }
        if (options.isPruneExternal()) {
            policies.add(new ExternalSpecPolicy());
        }
        if (options.isAffectedOnly()) {
            Set<String> affected = affectedSetCalculator.compute(
                    graph, inputs.getChangedIdentities(), options.getDependentTraverseDepth());
            policies.add(new UnaffectedPolicy(affected));
        }
        return policies;
    }

    private void logSummary(PipelineGraph graph, PruningResult result) {
        Comparator<SpecNode> byName = Comparator.comparing(SpecNode::getName).thenComparing(SpecNode::getIdentity);
        List<SpecNode> rebuild = graph.nodes().stream()
                .filter(n -> result.isKept(n.getIdentity()))
                .sorted(byName)
                .toList();
        List<SpecNode> pruned = graph.nodes().stream()
                .filter(n -> !result.isKept(n.getIdentity()))
                .sorted(byName)
                .toList();

        log.info("Pipeline pruning summary:");
        if (!rebuild.isEmpty()) {
            log.info("  Rebuild list:");
            rebuild.forEach(n -> log.info("    [x] {} ({})", n.describe(), result.reason(n.getIdentity())));
        }
        if (!pruned.isEmpty()) {
            log.info("  Prune list:");
            pruned.forEach(n -> log.info("     -  {} ({})", n.describe(), result.reason(n.getIdentity())));
        }
    }
}
