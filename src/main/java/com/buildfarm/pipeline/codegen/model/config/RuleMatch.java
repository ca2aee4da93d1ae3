package com.buildfarm.pipeline.codegen.model.config;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Predicate of a configuration rule. Unset fields match anything.
 *
 * Package names are matched as globs ({@code *} and {@code ?}); every other
 * field must be equal.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RuleMatch {

    public static final String ANY_PACKAGE = "*";

    @JsonProperty("package")
    @Builder.Default
    String packagePattern = ANY_PACKAGE;

    String version;

    String compiler;

    String platform;

    @Singular
    Map<String, String> variants;

    public static RuleMatch any() {
        return RuleMatch.builder().build();
    }

    public static RuleMatch forPackage(String pattern) {
        return RuleMatch.builder().packagePattern(pattern).build();
    }

    public boolean matches(SpecNode node) {
        if (!globMatches(packagePattern, node.getName())) {
            return false;
        }
        if (version != null && !version.equals(node.getVersion())) {
            return false;
        }
        if (compiler != null && !compiler.equals(node.getCompiler())) {
            return false;
        }
        if (platform != null && !platform.equals(node.getPlatform())) {
            return false;
        }
        for (Map.Entry<String, String> constraint : variants.entrySet()) {
            if (!Objects.equals(constraint.getValue(), node.getVariants().get(constraint.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of constrained fields. Each variant constraint counts once; the
     * match-all package pattern does not count.
     */
    public int specificity() {
        int score = 0;
        if (packagePattern != null && !ANY_PACKAGE.equals(packagePattern)) {
            score++;
        }
        if (version != null) {
            score++;
        }
        if (compiler != null) {
            score++;
        }
        if (platform != null) {
            score++;
        }
        return score + variants.size();
    }

    static boolean globMatches(String glob, String value) {
        if (glob == null || ANY_PACKAGE.equals(glob)) {
            return true;
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.matches(regex.toString(), value);
    }
}
