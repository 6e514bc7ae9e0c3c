package com.thedigest.continuity.service.budget;

import com.google.common.util.concurrent.RateLimiter;
import com.thedigest.continuity.dto.DailyUsage;
import com.thedigest.continuity.model.ApiUsage;
import com.thedigest.continuity.repository.ApiUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Daily cost ledger for generation calls, plus a per-second throttle.
 * Days roll over at midnight UTC.
 */
@Service
public class AiUsageBudgetService implements BudgetGatekeeper {

    private static final Logger logger = LoggerFactory.getLogger(AiUsageBudgetService.class);

    private final ApiUsageRepository usageRepository;
    private final RateLimiter generationRateLimiter;
    private final Clock clock;
    private final long dailyBudgetCents;
    private final double inputPricePerMillion;
    private final double outputPricePerMillion;

    public AiUsageBudgetService(ApiUsageRepository usageRepository,
                                @Qualifier("generationRateLimiter") RateLimiter generationRateLimiter,
                                Clock clock,
                                @Value("${app.budget.daily-cents:500}") long dailyBudgetCents,
                                @Value("${app.budget.input-price-per-million:3.0}") double inputPricePerMillion,
                                @Value("${app.budget.output-price-per-million:15.0}") double outputPricePerMillion) {
        this.usageRepository = usageRepository;
        this.generationRateLimiter = generationRateLimiter;
        this.clock = clock;
        this.dailyBudgetCents = Math.max(1, dailyBudgetCents);
        this.inputPricePerMillion = inputPricePerMillion;
        this.outputPricePerMillion = outputPricePerMillion;
    }

    @Override
    @SuppressWarnings("UnstableApiUsage")
    public boolean allowCall() {
        DailyUsage usage;
        try {
            usage = dailyUsage();
        } catch (DataAccessException e) {
            logger.warn("Usage ledger unavailable, refusing generation call: {}", e.getMessage());
            return false;
        }
        if (usage.isOverBudget()) {
            logger.info("Daily generation budget exhausted ({} of {} cents).", usage.costCents(), usage.budgetCents());
            return false;
        }
        if (!generationRateLimiter.tryAcquire()) {
            logger.debug("Generation rate limit reached; skipping call.");
            return false;
        }
        return true;
    }

    @Override
    public void recordUsage(int inputTokens, int outputTokens) {
        LocalDate today = today();
        long costCents = estimateCostCents(inputTokens, outputTokens);
        try {
            if (usageRepository.addUsage(today, inputTokens, outputTokens, costCents) > 0) {
                return;
            }
            try {
                usageRepository.save(ApiUsage.builder()
                        .usageDate(today)
                        .inputTokens(inputTokens)
                        .outputTokens(outputTokens)
                        .costCents(costCents)
                        .callCount(1)
                        .build());
            } catch (DataIntegrityViolationException race) {
                // another request created today's row first
                usageRepository.addUsage(today, inputTokens, outputTokens, costCents);
            }
        } catch (DataAccessException e) {
            logger.error("Failed to record generation usage ({} in / {} out): {}", inputTokens, outputTokens, e.getMessage());
        }
    }

    @Override
    public DailyUsage dailyUsage() {
        LocalDate today = today();
        ApiUsage usage = usageRepository.findById(today)
                .orElseGet(() -> ApiUsage.builder().usageDate(today).build());
        long costCents = usage.getCostCents();
        return new DailyUsage(
                today,
                usage.getInputTokens(),
                usage.getOutputTokens(),
                costCents,
                usage.getCallCount(),
                dailyBudgetCents,
                (int) Math.round(costCents * 100.0 / dailyBudgetCents),
                costCents >= dailyBudgetCents
        );
    }

    long estimateCostCents(long inputTokens, long outputTokens) {
        double dollars = (inputTokens / 1_000_000.0) * inputPricePerMillion
                + (outputTokens / 1_000_000.0) * outputPricePerMillion;
        return Math.round(dollars * 100);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
}
