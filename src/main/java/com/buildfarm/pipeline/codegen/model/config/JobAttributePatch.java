package com.buildfarm.pipeline.codegen.model.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Partial job attribute set carried by a configuration rule. A {@code null}
 * field leaves the merged value untouched.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JobAttributePatch {

    List<String> tags;

    Map<String, String> variables;

    @JsonProperty("stage-hint")
    Integer stageHint;

    @JsonProperty("allow-failure")
    Boolean allowFailure;

    String image;

    List<String> script;

    @JsonProperty("before-script")
    List<String> beforeScript;

    @JsonProperty("after-script")
    List<String> afterScript;

    String timeout;
}
