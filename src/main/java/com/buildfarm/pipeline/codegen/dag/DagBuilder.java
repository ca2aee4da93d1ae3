package com.buildfarm.pipeline.codegen.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.CyclicDependencyException;
import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;
import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;

/**
 * Assembles a {@link PipelineGraph} from the root specs of one generation run.
 *
 * Specs are visited depth first and hashed bottom up. A run-local node table
 * keyed by identity makes equal specs collapse into one shared node. Holds
 * per-run state: use one instance per run.
 */
public class DagBuilder {
    private static final Logger log = LoggerFactory.getLogger(DagBuilder.class);

    private final Map<String, SpecNode> nodeTable = new LinkedHashMap<>();
    private final Map<BuildSpec, String> identities = new IdentityHashMap<>();
    private final Set<BuildSpec> activePath = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<BuildSpec> pathStack = new ArrayList<>();
    private int sharedHits;

    public PipelineGraph build(List<BuildSpec> rootSpecs) {
        Set<String> roots = new LinkedHashSet<>();
        for (BuildSpec root : rootSpecs) {
            roots.add(visit(root));
        }

        PipelineGraph graph = new PipelineGraph(nodeTable.values(), roots);
        log.info("Built pipeline graph: {} roots, {} nodes, {} edges ({} shared references collapsed)",
                graph.roots().size(), graph.size(), graph.edgeCount(), sharedHits);
        return graph;
    }

    /**
     * Identity computed for a spec during {@link #build(List)}.
     *
     * @throws NoSuchElementException if the spec was not part of the run
     */
    public String identityOf(BuildSpec spec) {
        String identity = identities.get(spec);
        if (identity == null) {
            throw new NoSuchElementException("Spec " + spec.displayName() + " is not part of the pipeline graph");
        }
        return identity;
    }

    public boolean isKnown(BuildSpec spec) {
        return identities.containsKey(spec);
    }

    private String visit(BuildSpec spec) {
        String known = identities.get(spec);
        if (known != null) {
            sharedHits++;
            return known;
        }

        if (!activePath.add(spec)) {
            throw new CyclicDependencyException(describeCycle(spec));
        }
        pathStack.add(spec);
        try {
            Set<String> dependencyIds = new TreeSet<>();
            for (BuildSpec dependency : spec.getDependencies()) {
                dependencyIds.add(visit(dependency));
            }

            String identity = SpecHasher.identity(spec, dependencyIds);
            SpecNode existing = nodeTable.get(identity);
            if (existing == null) {
                nodeTable.put(identity, toNode(identity, spec, dependencyIds));
            } else {
                sharedHits++;
                log.debug("Reusing node {} for an equal spec object", existing.describe());
            }
            identities.put(spec, identity);
            return identity;
        } finally {
            pathStack.remove(pathStack.size() - 1);
            activePath.remove(spec);
        }
    }

    private List<String> describeCycle(BuildSpec repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (BuildSpec onPath : pathStack) {
            if (onPath == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(onPath.displayName());
            }
        }
        cycle.add(repeated.displayName());
        return cycle;
    }

    private static SpecNode toNode(String identity, BuildSpec spec, Set<String> dependencyIds) {
        SpecNode.SpecNodeBuilder builder = SpecNode.builder()
                .identity(identity)
                .name(spec.getName())
                .version(spec.getVersion())
                .compiler(spec.getCompiler())
                .platform(spec.getPlatform())
                .external(spec.isExternal())
                .dependencies(dependencyIds);
        if (spec.getVariants() != null) {
            builder.variants(spec.getVariants());
        }
        return builder.build();
    }
}
