package com.thedigest.continuity.controller;

import com.thedigest.continuity.dto.DailyUsage;
import com.thedigest.continuity.service.budget.BudgetGatekeeper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ai-usage")
@Tag(name = "AI Usage", description = "Daily generation spend against the budget")
public class AiUsageController {

    private final BudgetGatekeeper budgetGatekeeper;

    public AiUsageController(BudgetGatekeeper budgetGatekeeper) {
        this.budgetGatekeeper = budgetGatekeeper;
    }

    @Operation(summary = "Today's generation usage", description = "Token counts, estimated cost and call count for the current UTC day.")
    @GetMapping
    public ResponseEntity<DailyUsage> dailyUsage() {
        return ResponseEntity.ok(budgetGatekeeper.dailyUsage());
    }
}
