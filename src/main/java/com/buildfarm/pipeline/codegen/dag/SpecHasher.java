package com.buildfarm.pipeline.codegen.dag;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;

/**
 * Calculates the content identity of a build spec. Two specs with the same
 * name, version, variants, compiler, platform, external flag and dependency
 * identities get the same identity.
 *
 * Every value is written length-prefixed and null has its own marker, so no
 * two distinct specs share a canonical form.
 */
public final class SpecHasher {

    private static final int IDENTITY_LENGTH = 32;
    private static final String NULL_MARKER = "-";

    private SpecHasher() {
        // Utility class
    }

    /**
     * @param spec           the spec to hash
     * @param dependencyIds  identities of its direct dependencies, in any order
     */
    public static String identity(BuildSpec spec, Collection<String> dependencyIds) {
        StringBuilder sb = new StringBuilder();
        field(sb, "NAME", spec.getName());
        field(sb, "VERSION", spec.getVersion());

        Map<String, String> variants = spec.getVariants() == null ? Map.of() : new TreeMap<>(spec.getVariants());
        for (Map.Entry<String, String> variant : variants.entrySet()) {
            sb.append("VARIANT:").append(encode(variant.getKey())).append('=').append(encode(variant.getValue()))
                    .append('\n');
        }

        field(sb, "COMPILER", spec.getCompiler());
        field(sb, "PLATFORM", spec.getPlatform());
        field(sb, "EXTERNAL", String.valueOf(spec.isExternal()));

        for (String dep : new TreeSet<>(dependencyIds)) {
            field(sb, "DEP", dep);
        }
        return hashString(sb.toString());
    }

    private static void field(StringBuilder sb, String label, String value) {
        sb.append(label).append(':').append(encode(value)).append('\n');
    }

    // length:value, or the null marker; a length never starts with '-'
    static String encode(String value) {
        return value == null ? NULL_MARKER : value.length() + ":" + value;
    }

    private static String hashString(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, IDENTITY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
