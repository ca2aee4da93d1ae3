package com.buildfarm.pipeline.codegen.prune;

import java.util.Collections;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;

/**
 * Per-run pruning outcome, kept apart from the immutable graph: one status and
 * one human readable reason per node identity.
 */
public final class PruningResult {

    private final Map<String, NodeStatus> statuses;
    private final Map<String, String> reasons;

    public PruningResult(Map<String, NodeStatus> statuses, Map<String, String> reasons) {
        this.statuses = Collections.unmodifiableMap(new TreeMap<>(statuses));
        this.reasons = Collections.unmodifiableMap(new TreeMap<>(reasons));
    }

    public NodeStatus status(String identity) {
        NodeStatus status = statuses.get(identity);
        if (status == null) {
            throw new NoSuchElementException("No pruning status for " + identity);
        }
        return status;
    }

    public boolean contains(String identity) {
        return statuses.containsKey(identity);
    }

    public boolean isKept(String identity) {
        return status(identity) == NodeStatus.KEEP;
    }

    public String reason(String identity) {
        return reasons.getOrDefault(identity, "");
    }

    public Map<String, NodeStatus> statuses() {
        return statuses;
    }

    public Set<String> kept() {
        return withStatus(NodeStatus.KEEP);
    }

    public Set<String> withStatus(NodeStatus status) {
        return statuses.entrySet().stream()
                .filter(e -> e.getValue() == status)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public long count(NodeStatus status) {
        return statuses.values().stream().filter(s -> s == status).count();
    }
}
