package com.buildfarm.pipeline.codegen.environment;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One concrete spec of an environment document. Dependencies refer to other
 * entries by {@link #id}.
 */
@Value
@Builder
@Jacksonized
public class SpecEntry {

    String id;

    String name;

    String version;

    Map<String, String> variants;

    String compiler;

    String platform;

    boolean external;

    List<String> dependencies;
}
