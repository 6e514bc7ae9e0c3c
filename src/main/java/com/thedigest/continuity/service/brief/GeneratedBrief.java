package com.thedigest.continuity.service.brief;

import com.thedigest.continuity.dto.Brief;

/**
 * A brief plus the generation metadata stored alongside cached snapshots.
 * {@code modelUsed} is null when the deterministic fallback was used.
 */
public record GeneratedBrief(
        Brief brief,
        String modelUsed,
        int inputTokens,
        int outputTokens
) {
    public static GeneratedBrief fallback(Brief brief) {
        return new GeneratedBrief(brief, null, 0, 0);
    }
}
