package com.thedigest.continuity.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;

/**
 * An article eligible for the current delta window.
 *
 * @param searchText lower-cased title, source, content, summary and entity names
 * @param threadKey  grouping key only; never persisted as identity
 */
public record Candidate(
        String id,
        String title,
        String sourceUrl,
        String source,
        String topic,
        OffsetDateTime publishedAt,
        int significanceScore,
        String watchForNext,
        String summaryText,
        String searchText,
        List<String> reactions,
        String threadKey
) {
    public List<String> reactions() {
        return reactions == null ? List.of() : Collections.unmodifiableList(reactions);
    }
}
