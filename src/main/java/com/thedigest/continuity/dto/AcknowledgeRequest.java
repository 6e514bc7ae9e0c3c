package com.thedigest.continuity.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Marks the since-last-read checkpoint as read")
public class AcknowledgeRequest {
    @Schema(description = "Preferred depth to remember", example = "medium")
    private String depth;

    @Schema(description = "Watermark to store (ISO-8601); defaults to now", example = "2026-02-17T09:30:00Z")
    private String untilAt;
}
