package com.buildfarm.pipeline.codegen.generator.gitlab;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template model of one {@code .gitlab-ci.yml} job. String values are already
 * YAML-quoted; {@code null} fields are omitted from the output.
 */
@Value
@Builder
public class GitlabJobView {

    String name;

    String stage;

    String image;

    @Singular
    List<String> tags;

    @Singular
    List<YamlEntry> variables;

    @Singular("need")
    List<String> needs;

    @Singular("beforeScriptLine")
    List<String> beforeScript;

    @Singular("scriptLine")
    List<String> script;

    @Singular("afterScriptLine")
    List<String> afterScript;

    @Singular("artifactPath")
    List<String> artifactPaths;

    String timeout;

    String when;

    boolean allowFailure;

    int retryMax;

    @Singular("retryCondition")
    List<String> retryWhen;

    boolean interruptible;

    /**
     * Service jobs do not inherit artifacts from earlier stages.
     */
    boolean clearDependencies;
}
