package com.buildfarm.pipeline.codegen.generator.gitlab;

import com.buildfarm.pipeline.codegen.util.YamlScalars;

import lombok.Value;

/**
 * Key/value pair with both sides already quoted for the template.
 */
@Value
public class YamlEntry {

    String key;
    String value;

    public static YamlEntry of(String key, String value) {
        return new YamlEntry(YamlScalars.quote(key), YamlScalars.quote(value == null ? "" : value));
    }
}
