package com.buildfarm.pipeline.codegen.environment;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw environment document as read from YAML or JSON.
 */
@Value
@Builder
@Jacksonized
public class EnvironmentDocument {

    @Singular
    List<SpecEntry> specs;

    @Singular
    List<String> roots;

    /**
     * Entries already present in the build cache.
     */
    @JsonProperty("available")
    @Singular("availableId")
    List<String> availableIds;

    @JsonProperty("broken")
    @Singular("brokenId")
    List<String> brokenIds;

    @JsonProperty("changed")
    @Singular("changedId")
    List<String> changedIds;

    @JsonProperty("changed-packages")
    @Singular
    List<String> changedPackages;
}
