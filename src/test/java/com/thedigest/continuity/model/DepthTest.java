package com.thedigest.continuity.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DepthTest {

    @Test
    void parsesCurrentAndLegacyCodes() {
        assertThat(Depth.parse("shallow")).contains(Depth.SHALLOW);
        assertThat(Depth.parse("2m")).contains(Depth.SHALLOW);
        assertThat(Depth.parse(" 10M ")).contains(Depth.MEDIUM);
        assertThat(Depth.parse("Deep")).contains(Depth.DEEP);
    }

    @Test
    void rejectsUnknownCodes() {
        assertThat(Depth.parse(null)).isEmpty();
        assertThat(Depth.parse("")).isEmpty();
        assertThat(Depth.parse("forever")).isEmpty();
    }

    @Test
    void limitsGrowWithDepth() {
        assertThat(Depth.SHALLOW.config().isAtMost(Depth.MEDIUM.config())).isTrue();
        assertThat(Depth.MEDIUM.config().isAtMost(Depth.DEEP.config())).isTrue();
        assertThat(Depth.DEEP.config().isAtMost(Depth.SHALLOW.config())).isFalse();
    }

    @Test
    void shallowLimitsMatchTheTwoMinuteBrief() {
        DepthConfig config = Depth.SHALLOW.config();
        assertThat(config.highlightLimit()).isEqualTo(4);
        assertThat(config.citationLimit()).isEqualTo(4);
        assertThat(config.maxTokens()).isEqualTo(600);
        assertThat(config.changedBulletLimit()).isEqualTo(3);
        assertThat(config.watchNextLimit()).isEqualTo(2);
    }
}
