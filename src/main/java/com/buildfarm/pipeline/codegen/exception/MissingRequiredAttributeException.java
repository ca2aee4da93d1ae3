package com.buildfarm.pipeline.codegen.exception;

import java.util.List;

/**
 * A job survived pruning but the configuration does not give it every
 * mandatory attribute.
 */
public class MissingRequiredAttributeException extends PipelineGenerationException {

    private static final long serialVersionUID = 1L;
    private final String identity;
    private final List<String> missingFields;

    public MissingRequiredAttributeException(String identity, String description, List<String> missingFields) {
        super(String.format("Job for %s (%s) is missing required attribute(s) %s; add a matching pipeline-gen rule",
                description, identity, missingFields));
        this.identity = identity;
        this.missingFields = List.copyOf(missingFields);
    }

    public String getIdentity() {
        return identity;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
