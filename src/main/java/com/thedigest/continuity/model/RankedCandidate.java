package com.thedigest.continuity.model;

import java.util.List;

public record RankedCandidate(
        Candidate candidate,
        List<String> watchlistMatches,
        String reason,
        double score
) {
    public String id() {
        return candidate.id();
    }

    public String threadKey() {
        return candidate.threadKey();
    }

    public boolean hasWatchlistMatch() {
        return watchlistMatches != null && !watchlistMatches.isEmpty();
    }
}
