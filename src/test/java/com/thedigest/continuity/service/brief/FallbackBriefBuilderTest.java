package com.thedigest.continuity.service.brief;

import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.dto.Highlight;
import com.thedigest.continuity.model.Depth;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackBriefBuilderTest {

    private static final OffsetDateTime LAST_SEEN = OffsetDateTime.parse("2026-02-17T09:05:00Z");

    @Test
    void emptyDeltaSaysNothingMajorChanged() {
        Brief brief = FallbackBriefBuilder.build(List.of(), List.of("Court ruling pending"), Depth.SHALLOW, 0, LAST_SEEN);

        assertThat(brief.headline()).isEqualTo("No major new updates since Feb 17, 9:05 AM UTC");
        assertThat(brief.summary()).startsWith("You are caught up.");
        assertThat(brief.changed()).isEmpty();
        assertThat(brief.unchanged()).containsExactly("Still in play: Court ruling pending");
        assertThat(brief.watchNext()).isEmpty();
    }

    @Test
    void firstVisitMentionsTheLastDay() {
        Brief brief = FallbackBriefBuilder.build(List.of(highlight(1, null)), List.of(), Depth.SHALLOW, 1, null);

        assertThat(brief.headline()).isEqualTo("1 new story in the last 24 hours");
        assertThat(brief.summary()).isEqualTo("Story 1 leads the change set, followed by broader coverage shifts.");
    }

    @Test
    void bulletsFollowTheDepthLimits() {
        List<Highlight> highlights = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            highlights.add(highlight(i, i % 2 == 0 ? "Watch " + i : null));
        }

        Brief brief = FallbackBriefBuilder.build(highlights,
                List.of("One", "Two", "Three", "Four"), Depth.SHALLOW, 9, LAST_SEEN);

        assertThat(brief.headline()).startsWith("9 new stories since");
        assertThat(brief.summary()).isEqualTo("Story 1 leads the change set, followed by source2.com, source3.com.");
        assertThat(brief.changed()).containsExactly(
                "1. Story 1 (source1.com)", "2. Story 2 (source2.com)", "3. Story 3 (source3.com)");
        assertThat(brief.unchanged()).hasSize(3);
        assertThat(brief.watchNext()).containsExactly("Watch 2", "Watch 4");
    }

    private static Highlight highlight(int index, String watchForNext) {
        return new Highlight("a" + index, "Story " + index, "source" + index + ".com", "https://source" + index + ".com",
                "tech", LAST_SEEN.plusMinutes(index), 6, List.of(), "Important recent update", watchForNext);
    }
}
