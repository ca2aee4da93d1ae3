package com.buildfarm.pipeline.codegen.dag;

import static com.buildfarm.pipeline.codegen.SpecFixtures.spec;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.buildfarm.pipeline.codegen.model.spec.BuildSpec;

/**
 * Unit tests for SpecHasher.
 */
class SpecHasherTest {

    @Test
    void testEqualContentGivesEqualIdentity() {
        String first = SpecHasher.identity(spec("zlib", "1.3"), List.of());
        String second = SpecHasher.identity(spec("zlib", "1.3"), List.of());

        assertThat(first).isEqualTo(second).hasSize(32).matches("[0-9a-f]+");
    }

    @Test
    void testVersionChangesIdentity() {
        assertThat(SpecHasher.identity(spec("zlib", "1.3"), List.of()))
                .isNotEqualTo(SpecHasher.identity(spec("zlib", "1.2.13"), List.of()));
    }

    @Test
    void testVariantOrderDoesNotMatter() {
        Map<String, String> ordered = new TreeMap<>(Map.of("shared", "true", "pic", "false"));
        BuildSpec a = spec("zlib").toBuilder().variants(ordered).build();
        BuildSpec b = spec("zlib").toBuilder().variants(Map.of("pic", "false", "shared", "true")).build();

        assertThat(SpecHasher.identity(a, List.of())).isEqualTo(SpecHasher.identity(b, List.of()));
    }

    @Test
    void testDependencyOrderDoesNotMatterButContentDoes() {
        BuildSpec spec = spec("cmake");

        assertThat(SpecHasher.identity(spec, List.of("aaa", "bbb")))
                .isEqualTo(SpecHasher.identity(spec, List.of("bbb", "aaa")))
                .isNotEqualTo(SpecHasher.identity(spec, List.of("aaa")));
    }

    @Test
    void testVariantSeparatorInKeyOrValueDoesNotCollide() {
        BuildSpec keyWithEquals = spec("zlib").toBuilder().variants(Map.of("a=b", "c")).build();
        BuildSpec valueWithEquals = spec("zlib").toBuilder().variants(Map.of("a", "b=c")).build();

        assertThat(SpecHasher.identity(keyWithEquals, List.of()))
                .isNotEqualTo(SpecHasher.identity(valueWithEquals, List.of()));
    }

    @Test
    void testMissingVersionDiffersFromAnyLiteral() {
        String missing = SpecHasher.identity(spec("zlib", null), List.of());

        assertThat(missing)
                .isNotEqualTo(SpecHasher.identity(spec("zlib", "NULL"), List.of()))
                .isNotEqualTo(SpecHasher.identity(spec("zlib", "-"), List.of()))
                .isNotEqualTo(SpecHasher.identity(spec("zlib", ""), List.of()));
    }

    @Test
    void testWhitespaceIsSignificant() {
        assertThat(SpecHasher.identity(spec("zlib", "1.0 "), List.of()))
                .isNotEqualTo(SpecHasher.identity(spec("zlib", "1.0"), List.of()));
    }

    @Test
    void testExternalFlagChangesIdentity() {
        BuildSpec built = spec("cmake", "3.27");
        BuildSpec provided = built.toBuilder().external(true).build();

        assertThat(SpecHasher.identity(built, List.of()))
                .isNotEqualTo(SpecHasher.identity(provided, List.of()));
    }

    @Test
    void testEncodingIsLengthPrefixed() {
        assertThat(SpecHasher.encode("b=c")).isEqualTo("3:b=c");
        assertThat(SpecHasher.encode(null)).isEqualTo("-");
    }
}
