package com.thedigest.continuity.dto;

import java.time.OffsetDateTime;

public record Citation(
        String articleId,
        String title,
        String source,
        String sourceUrl,
        OffsetDateTime publishedAt
) {
    public static Citation from(Highlight highlight) {
        return new Citation(
                highlight.articleId(),
                highlight.title(),
                highlight.source(),
                highlight.sourceUrl(),
                highlight.publishedAt()
        );
    }
}
