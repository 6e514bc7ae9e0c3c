package com.thedigest.continuity.dto;

public record AcknowledgeResponse(
        boolean success,
        ContinuityStateView state
) {
}
