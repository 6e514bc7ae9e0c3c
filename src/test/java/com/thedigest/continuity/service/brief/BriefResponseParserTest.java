package com.thedigest.continuity.service.brief;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.model.Depth;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BriefResponseParserTest {

    private final BriefResponseParser parser = new BriefResponseParser(new ObjectMapper());

    private final Brief fallback = new Brief("Fallback headline", "Fallback summary",
            List.of("1. Fallback (x.com)"), List.of("Still in play: Y"), List.of("Fallback watch"));

    @Test
    void extractsObjectWrappedInProse() {
        String text = "Here is the brief:\n{\"headline\": \"Chips rally [A1]\", \"summary\": \"S\"}\nHope it helps.";

        assertThat(parser.parseJsonObject(text)).isPresent();
        Brief brief = parser.toBrief(text, fallback, Depth.SHALLOW.config());

        assertThat(brief.headline()).isEqualTo("Chips rally [A1]");
        assertThat(brief.summary()).isEqualTo("S");
        assertThat(brief.changed()).isEqualTo(fallback.changed());
    }

    @Test
    void malformedFieldsFallBackIndividually() {
        String text = """
                {"headline": 42, "summary": "  ", "changed": ["[A1] Up", "", 7, "[A2] Down", "[A3] Flat", "[A4] Extra"],
                 "unchanged": "nope", "watchNext": []}
                """;

        Brief brief = parser.toBrief(text, fallback, Depth.SHALLOW.config());

        assertThat(brief.headline()).isEqualTo("Fallback headline");
        assertThat(brief.summary()).isEqualTo("Fallback summary");
        assertThat(brief.changed()).containsExactly("[A1] Up", "[A2] Down", "[A3] Flat");
        assertThat(brief.unchanged()).isEqualTo(fallback.unchanged());
        assertThat(brief.watchNext()).isEqualTo(fallback.watchNext());
    }

    @Test
    void unparseableTextReturnsTheWholeFallback() {
        assertThat(parser.toBrief("no json here", fallback, Depth.DEEP.config())).isEqualTo(fallback);
        assertThat(parser.toBrief("[1, 2]", fallback, Depth.DEEP.config())).isEqualTo(fallback);
        assertThat(parser.toBrief(null, fallback, Depth.DEEP.config())).isEqualTo(fallback);
    }
}
