package com.thedigest.continuity.service.source;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcWatchlistSourceTest {

    @Test
    void dedupesCaseInsensitivelyKeepingFirstSpelling() {
        assertThat(JdbcWatchlistSource.dedupe(Arrays.asList(" Nvidia ", "NVIDIA", "OpenAI", null, "", "openai", "EU")))
                .containsExactly("Nvidia", "OpenAI", "EU");
    }
}
