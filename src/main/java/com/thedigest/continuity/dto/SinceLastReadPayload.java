package com.thedigest.continuity.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;

/**
 * Full since-last-read result; the unit stored in and served from the snapshot cache.
 */
@Builder(toBuilder = true)
@Schema(description = "What changed since the client last looked, and what of it matters")
public record SinceLastReadPayload(
        SnapshotState state,
        SnapshotCounts counts,
        List<Highlight> highlights,
        Brief brief,
        List<Citation> citations
) {
    public SinceLastReadPayload {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
