package com.thedigest.continuity.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;

/**
 * Short catch-up narrative. Always structurally complete: null text becomes an empty
 * string and null lists become empty lists.
 */
@Builder(toBuilder = true)
@Schema(description = "Narrative catch-up brief, either model-written or assembled from ranked data")
public record Brief(
        @Schema(description = "One-sentence headline", example = "6 new stories since your last visit")
        String headline,
        @Schema(description = "Two-sentence summary")
        String summary,
        @Schema(description = "What changed, one bullet per development")
        List<String> changed,
        @Schema(description = "Ongoing threads with no fresh update")
        List<String> unchanged,
        @Schema(description = "Follow-ups worth watching")
        List<String> watchNext
) {
    public Brief {
        headline = headline == null ? "" : headline;
        summary = summary == null ? "" : summary;
        changed = changed == null ? List.of() : List.copyOf(changed);
        unchanged = unchanged == null ? List.of() : List.copyOf(unchanged);
        watchNext = watchNext == null ? List.of() : List.copyOf(watchNext);
    }
}
