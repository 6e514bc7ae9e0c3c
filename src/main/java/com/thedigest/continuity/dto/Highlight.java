package com.thedigest.continuity.dto;

import com.thedigest.continuity.model.RankedCandidate;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;

@Schema(description = "Ranked article selected for display")
public record Highlight(
        @Schema(description = "Article id", example = "3f6c2a1e-7d1b-4c0a-9e3f-1a2b3c4d5e6f")
        String articleId,
        String title,
        @Schema(description = "Host name of the source", example = "reuters.com")
        String source,
        String sourceUrl,
        String topic,
        OffsetDateTime publishedAt,
        @Schema(description = "Significance on a 1-10 scale", example = "8")
        int significanceScore,
        List<String> watchlistMatches,
        @Schema(description = "Why the item was ranked where it is", example = "Tracks your watchlist: Nvidia")
        String reason,
        String watchForNext
) {
    public Highlight {
        watchlistMatches = watchlistMatches == null ? List.of() : List.copyOf(watchlistMatches);
    }

    public static Highlight from(RankedCandidate ranked) {
        return new Highlight(
                ranked.candidate().id(),
                ranked.candidate().title(),
                ranked.candidate().source(),
                ranked.candidate().sourceUrl(),
                ranked.candidate().topic(),
                ranked.candidate().publishedAt(),
                ranked.candidate().significanceScore(),
                ranked.watchlistMatches(),
                ranked.reason(),
                ranked.candidate().watchForNext()
        );
    }
}
