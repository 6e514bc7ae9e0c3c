package com.thedigest.continuity.dto;

public record SnapshotCounts(
        int newArticles,
        int newThreads,
        int watchlistHits
) {
}
