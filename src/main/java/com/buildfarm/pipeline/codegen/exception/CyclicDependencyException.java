package com.buildfarm.pipeline.codegen.exception;

import java.util.List;

/**
 * A dependency closure handed to the dag builder is not acyclic.
 */
public class CyclicDependencyException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Package names along the cycle; the first entry is repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
