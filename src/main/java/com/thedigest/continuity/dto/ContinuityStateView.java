package com.thedigest.continuity.dto;

import com.thedigest.continuity.model.Depth;

import java.time.OffsetDateTime;

public record ContinuityStateView(
        String clientId,
        OffsetDateTime lastSeenAt,
        Depth preferredDepth
) {
}
