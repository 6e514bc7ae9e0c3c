package com.thedigest.continuity.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Article row as returned by the item store. Intelligence and summary fields are
 * best-effort and may be null when the store could only answer the plain query.
 */
public record ArticleRecord(
        String id,
        String title,
        String url,
        String topic,
        String content,
        OffsetDateTime publishedAt,
        ArticleSummary summary,
        Integer significanceScore,
        String storyType,
        String storyThreadId,
        String watchForNext
) {

    public static final String DEFAULT_STORY_TYPE = "update";

    public String storyTypeOrDefault() {
        return storyType == null || storyType.isBlank() ? DEFAULT_STORY_TYPE : storyType;
    }

    /**
     * Precomputed summary sections plus the key entity names extracted alongside them.
     */
    public record ArticleSummary(
            String brief,
            String theNews,
            String whyItMatters,
            String theContext,
            List<String> keyEntities
    ) {
        public List<String> keyEntities() {
            return keyEntities == null ? List.of() : keyEntities;
        }
    }
}
