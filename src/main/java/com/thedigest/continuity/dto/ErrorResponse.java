package com.thedigest.continuity.dto;

public record ErrorResponse(String error) {
}
