package com.openforge.filemate.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionTagTest {

    @Test
    void parsesSimpleAndSemanticTags() {
        assertThat(VersionTag.parse("v1.2")).isEqualTo(VersionTag.of(1, 2));
        assertThat(VersionTag.parse("V2.0.7")).isEqualTo(VersionTag.of(2, 0, 7));
    }

    @Test
    void parseRejectsAnythingButATag() {
        assertThatThrownBy(() -> VersionTag.parse("1.2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VersionTag.parse("plan_v1.2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VersionTag.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findInReturnsTheLastTagOfAStem() {
        assertThat(VersionTag.findIn("plan_v1.2_v1.3")).contains(VersionTag.of(1, 3));
        assertThat(VersionTag.findIn("运维方案_20240101_V3.10")).contains(VersionTag.of(3, 10));
        assertThat(VersionTag.findIn("no version here")).isEmpty();
    }

    @Test
    void findInSkipsOverflowingComponents() {
        assertThat(VersionTag.findIn("a_v1.1_v99999999999.0")).contains(VersionTag.of(1, 1));
    }

    @Test
    void ordersLexicographicallyWithMissingPatchAsZero() {
        assertThat(VersionTag.of(1, 10)).isGreaterThan(VersionTag.of(1, 9, 9));
        assertThat(VersionTag.of(2, 0)).isGreaterThan(VersionTag.of(1, 99));
        assertThat(VersionTag.of(1, 2).compareTo(VersionTag.of(1, 2, 0))).isZero();
    }

    @Test
    void componentAtIntegerLimitCannotAdvance() {
        VersionTag maxMinor = VersionTag.of(1, Integer.MAX_VALUE);

        assertThat(maxMinor.canAdvance(VersionFormat.SIMPLE)).isFalse();
        assertThat(maxMinor.canAdvance(VersionFormat.SEMANTIC)).isTrue();
        assertThatThrownBy(() -> maxMinor.next(VersionFormat.SIMPLE)).isInstanceOf(ArithmeticException.class);
        assertThat(VersionTag.of(1, 0, Integer.MAX_VALUE).canAdvance(VersionFormat.SEMANTIC)).isFalse();
    }

    @Test
    void nextFollowsTheFormat() {
        assertThat(VersionTag.of(1, 2, 3).next(VersionFormat.SIMPLE)).hasToString("v1.3");
        assertThat(VersionTag.of(1, 2).next(VersionFormat.SEMANTIC)).hasToString("v1.2.1");
        assertThat(VersionTag.of(1, 2, 3).next(VersionFormat.SEMANTIC)).hasToString("v1.2.4");
    }

    @Test
    void semanticFormAlwaysCarriesAPatch() {
        assertThat(VersionTag.of(1, 0).in(VersionFormat.SEMANTIC)).hasToString("v1.0.0");
        assertThat(VersionTag.of(1, 0).in(VersionFormat.SIMPLE)).hasToString("v1.0");
    }
}
