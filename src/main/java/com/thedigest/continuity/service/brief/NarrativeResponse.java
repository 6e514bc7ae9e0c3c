package com.thedigest.continuity.service.brief;

public record NarrativeResponse(
        String text,
        String modelId,
        int inputTokens,
        int outputTokens
) {
}
