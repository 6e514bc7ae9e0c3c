package com.thedigest.continuity.service.ranking;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WatchlistMatcherTest {

    @Test
    void shortTermsRequireWordBoundaries() {
        assertThat(WatchlistMatcher.matches("the minister said nothing", List.of("AI"))).isEmpty();
        assertThat(WatchlistMatcher.matches("new ai rules in brussels", List.of("AI"))).containsExactly("AI");
    }

    @Test
    void longTermsMatchAsSubstringsKeepingOriginalCasing() {
        assertThat(WatchlistMatcher.matches("openai's latest model", List.of("OpenAI", "Anthropic")))
                .containsExactly("OpenAI");
    }

    @Test
    void blankAndNullTermsAreIgnored() {
        assertThat(WatchlistMatcher.matches("anything", Arrays.asList(null, " ", ""))).isEmpty();
        assertThat(WatchlistMatcher.matches(null, List.of("x"))).isEmpty();
    }
}
