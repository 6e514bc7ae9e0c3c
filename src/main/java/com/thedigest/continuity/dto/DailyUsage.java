package com.thedigest.continuity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DailyUsage(
        LocalDate date,
        long inputTokens,
        long outputTokens,
        long costCents,
        int callCount,
        long budgetCents,
        int budgetUsedPercent,
        @JsonProperty("isOverBudget")
        boolean isOverBudget
) {
}
