package com.buildfarm.pipeline.codegen.model.config;

import java.util.Comparator;

import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One {@code pipeline-gen} entry: a match predicate and the attributes it sets.
 * Precedence is data, not evaluation order: specificity first, then the
 * declaration index (later wins).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConfigRule {

    /**
     * Ascending precedence: the last rule applied wins.
     */
    public static final Comparator<ConfigRule> PRECEDENCE =
            Comparator.comparingInt(ConfigRule::specificity).thenComparingInt(ConfigRule::getDeclarationIndex);

    @JsonIgnore
    int declarationIndex;

    @NonNull
    @Builder.Default
    RuleMatch match = RuleMatch.any();

    @NonNull
    @JsonProperty("build-job")
    JobAttributePatch attributes;

    public boolean matches(SpecNode node) {
        return match.matches(node);
    }

    public int specificity() {
        return match.specificity();
    }
}
