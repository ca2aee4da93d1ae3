package com.buildfarm.pipeline.codegen.model.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code ci} section of the configuration: the target platform, the
 * ordered attribute rules and the attributes of the service jobs.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CiConfig {

    @Builder.Default
    String target = "gitlab";

    @JsonProperty("rebuild-index")
    @Builder.Default
    boolean rebuildIndex = true;

    @JsonProperty("pipeline-gen")
    @Singular
    List<ConfigRule> rules;

    /**
     * Attributes of the placeholder job written when nothing needs rebuilding.
     */
    @JsonProperty("noop-job")
    JobAttributePatch noopJob;

    /**
     * Attributes of the job that signs the built packages. Only used by
     * protected branch pipelines.
     */
    @JsonProperty("signing-job")
    JobAttributePatch signingJob;

    /**
     * Attributes of the final job that refreshes the build cache index.
     */
    @JsonProperty("reindex-job")
    JobAttributePatch reindexJob;

    public static CiConfig empty() {
        return CiConfig.builder().build();
    }
}
