package com.thedigest.continuity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.thedigest.continuity.model.Depth;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.OffsetDateTime;

@Builder(toBuilder = true)
@Schema(description = "Echo of the continuity state the snapshot was computed against")
public record SnapshotState(
        String clientId,
        Depth depth,
        @Schema(description = "Watermark before this request; null on a first visit")
        OffsetDateTime lastSeenAt,
        OffsetDateTime sinceAt,
        OffsetDateTime untilAt,
        @JsonProperty("isFirstVisit")
        boolean isFirstVisit,
        @Schema(description = "True when the payload was served from the snapshot cache")
        boolean cached,
        String snapshotHash
) {
}
