package com.buildfarm.pipeline.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import com.buildfarm.pipeline.codegen.model.config.ConfigRule;
import com.buildfarm.pipeline.codegen.model.config.JobAttributePatch;
import com.buildfarm.pipeline.codegen.model.config.RuleMatch;
import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;

/**
 * Shared builders for test specs and rules.
 */
public final class SpecFixtures {

    private SpecFixtures() {
    }

    public static BuildSpec spec(String name) {
        return spec(name, "1.0");
    }

    public static BuildSpec spec(String name, String version) {
        return BuildSpec.builder()
                .name(name)
                .version(version)
                .compiler("gcc@12.2.0")
                .platform("linux-x86_64")
                .variants(new TreeMap<>())
                .dependencies(new ArrayList<>())
                .build();
    }

    public static BuildSpec external(String name) {
        return spec(name).toBuilder().external(true).dependencies(new ArrayList<>()).build();
    }

    /**
     * R depends on A and B, A depends on C.
     */
    public static List<BuildSpec> sampleTree() {
        BuildSpec c = spec("C");
        BuildSpec a = spec("A").dependsOn(c);
        BuildSpec b = spec("B");
        BuildSpec r = spec("R").dependsOn(a).dependsOn(b);
        return List.of(r, a, b, c);
    }

    public static ConfigRule rule(int index, RuleMatch match, JobAttributePatch patch) {
        return ConfigRule.builder()
                .declarationIndex(index)
                .match(match)
                .attributes(patch)
                .build();
    }

    public static JobAttributePatch tagsAndStage(String... tags) {
        return JobAttributePatch.builder()
                .tags(List.of(tags))
                .stageHint(0)
                .script(List.of("make install"))
                .build();
    }
}
