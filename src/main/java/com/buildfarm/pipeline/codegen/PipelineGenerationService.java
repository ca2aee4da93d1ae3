package com.buildfarm.pipeline.codegen;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.attributes.AttributeResolver;
import com.buildfarm.pipeline.codegen.dag.DagBuilder;
import com.buildfarm.pipeline.codegen.environment.ConcreteEnvironment;
import com.buildfarm.pipeline.codegen.exception.PipelineGenerationException;
import com.buildfarm.pipeline.codegen.generator.AnnotatedPipeline;
import com.buildfarm.pipeline.codegen.generator.GeneratorRegistry;
import com.buildfarm.pipeline.codegen.generator.PipelineGenerator;
import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.config.JobAttributes;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;
import com.buildfarm.pipeline.codegen.model.core.context.PruningInputs;
import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;
import com.buildfarm.pipeline.codegen.model.spec.NodeStatus;
import com.buildfarm.pipeline.codegen.model.spec.PipelineGraph;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.buildfarm.pipeline.codegen.prune.Pruner;
import com.buildfarm.pipeline.codegen.prune.PruningResult;

/**
 * Runs one generation: graph, pruning, attributes, generator lookup and
 * output. Stateless between runs; the registry is shared and read-only.
 */
public class PipelineGenerationService {
    private static final Logger log = LoggerFactory.getLogger(PipelineGenerationService.class);

    private final GeneratorRegistry registry;
    private final Pruner pruner;

    public PipelineGenerationService() {
        this(GeneratorRegistry.withDefaults());
    }

    public PipelineGenerationService(GeneratorRegistry registry) {
        this(registry, new Pruner());
    }

    public PipelineGenerationService(GeneratorRegistry registry, Pruner pruner) {
        this.registry = registry;
        this.pruner = pruner;
    }

    /**
     * Generates the pipeline file. Failures are logged and reported in the
     * result, never thrown.
     */
    public GeneratorResult generate(ConcreteEnvironment environment, CiConfig config, PipelineOptions options) {
        try {
            log.info("Starting pipeline generation...");
            PipelineOptions effective = options.toBuilder()
                    .rebuildIndex(options.isRebuildIndex() && config.isRebuildIndex())
                    .build();

            // Step 1: Build the graph
            log.info("Step 1: Building pipeline graph...");
            DagBuilder dagBuilder = new DagBuilder();
            PipelineGraph graph = dagBuilder.build(environment.getRoots());
            PruningInputs inputs = pruningInputs(environment, dagBuilder, graph);

            // Step 2: Prune
            log.info("Step 2: Pruning...");
            PruningResult pruning = pruner.prune(graph, effective, inputs);

            // Step 3: Resolve job attributes
            log.info("Step 3: Resolving job attributes...");
            Map<String, JobAttributes> attributes = new AttributeResolver(config.getRules()).resolveAll(graph, pruning);

            // Step 4: Look up the generator
            log.info("Step 4: Resolving generator '{}'...", effective.getPlatform());
            PipelineGenerator generator = registry.resolve(effective.getPlatform());

            // Step 5: Write the pipeline
            log.info("Step 5: Writing pipeline to {}...", effective.getOutputPath());
            AnnotatedPipeline pipeline = AnnotatedPipeline.builder()
                    .graph(graph)
                    .pruning(pruning)
                    .attributes(attributes)
                    .cachedIdentities(inputs.getAvailableIdentities())
                    .build();
            generator.generate(pipeline, config, effective);

            log.info("Pipeline generation complete!");
            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(effective.getOutputPath())
                    .platform(generator.platform())
                    .nodeCount(graph.size())
                    .edgeCount(graph.edgeCount())
                    .jobCount(attributes.size())
                    .prunedBroken(pruning.count(NodeStatus.PRUNED_BROKEN))
                    .prunedAvailable(pruning.count(NodeStatus.PRUNED_AVAILABLE))
                    .prunedExternal(pruning.count(NodeStatus.PRUNED_EXTERNAL))
                    .prunedUnaffected(pruning.count(NodeStatus.PRUNED_UNAFFECTED))
                    .build();

        } catch (PipelineGenerationException e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("Generation failure details", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Maps the environment's flagged specs onto graph identities. Changed
     * package names expand to every node of that name.
     */
    static PruningInputs pruningInputs(ConcreteEnvironment environment, DagBuilder dagBuilder, PipelineGraph graph) {
        PruningInputs.PruningInputsBuilder inputs = PruningInputs.builder();
        identities(environment.getAvailableSpecs(), dagBuilder, "available").forEach(inputs::available);
        identities(environment.getBrokenSpecs(), dagBuilder, "broken").forEach(inputs::broken);

        Set<String> changed = identities(environment.getChangedSpecs(), dagBuilder, "changed");
        for (String packageName : environment.getChangedPackages()) {
            List<SpecNode> matches = graph.findByName(packageName);
            if (matches.isEmpty()) {
                log.warn("Changed package '{}' is not part of the pipeline graph", packageName);
            }
            matches.stream().map(SpecNode::getIdentity).forEach(changed::add);
        }
        changed.forEach(inputs::changed);
        return inputs.build();
    }

    private static Set<String> identities(List<BuildSpec> specs, DagBuilder dagBuilder, String role) {
        Set<String> ids = new TreeSet<>();
        for (BuildSpec spec : specs) {
            if (dagBuilder.isKnown(spec)) {
                ids.add(dagBuilder.identityOf(spec));
            } else {
                log.warn("Ignoring {} spec {}: not reachable from any root", role, spec.displayName());
            }
        }
        return ids;
    }
}
