package com.thedigest.continuity.service.budget;

import com.google.common.util.concurrent.RateLimiter;
import com.thedigest.continuity.dto.DailyUsage;
import com.thedigest.continuity.model.ApiUsage;
import com.thedigest.continuity.repository.ApiUsageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiUsageBudgetServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 2, 17);

    @Mock
    private ApiUsageRepository usageRepository;

    @Mock
    private RateLimiter rateLimiter;

    private AiUsageBudgetService budgetService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-17T23:30:00Z"), ZoneOffset.UTC);
        budgetService = new AiUsageBudgetService(usageRepository, rateLimiter, clock, 500, 3.0, 15.0);
    }

    @Test
    void estimatesCostInCents() {
        // 1M in at $3 + 100k out at $15 = $4.50
        assertThat(budgetService.estimateCostCents(1_000_000, 100_000)).isEqualTo(450);
        assertThat(budgetService.estimateCostCents(1_000, 200)).isEqualTo(1);
    }

    @Test
    void allowsCallUnderBudgetWhenLimiterHasPermit() {
        when(usageRepository.findById(TODAY)).thenReturn(Optional.of(usage(120)));
        when(rateLimiter.tryAcquire()).thenReturn(true);

        assertThat(budgetService.allowCall()).isTrue();
    }

    @Test
    void refusesCallOnceBudgetIsSpent() {
        when(usageRepository.findById(TODAY)).thenReturn(Optional.of(usage(500)));

        assertThat(budgetService.allowCall()).isFalse();
        verify(rateLimiter, never()).tryAcquire();
    }

    @Test
    void refusesCallWhenRateLimited() {
        when(usageRepository.findById(TODAY)).thenReturn(Optional.empty());
        when(rateLimiter.tryAcquire()).thenReturn(false);

        assertThat(budgetService.allowCall()).isFalse();
    }

    @Test
    void refusesCallWhenLedgerIsUnreadable() {
        when(usageRepository.findById(TODAY)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(budgetService.allowCall()).isFalse();
    }

    @Test
    void recordUsageCreatesTodaysRowOnFirstCall() {
        when(usageRepository.addUsage(TODAY, 1000, 200, 1)).thenReturn(0);

        budgetService.recordUsage(1000, 200);

        verify(usageRepository).save(any(ApiUsage.class));
    }

    @Test
    void recordUsageRetriesIncrementWhenAnotherRequestCreatedTheRow() {
        when(usageRepository.addUsage(TODAY, 1000, 200, 1)).thenReturn(0, 1);
        when(usageRepository.save(any(ApiUsage.class))).thenThrow(new DataIntegrityViolationException("duplicate key"));

        budgetService.recordUsage(1000, 200);

        verify(usageRepository, times(2)).addUsage(TODAY, 1000, 200, 1);
    }

    @Test
    void dailyUsageReportsPercentOfBudget() {
        when(usageRepository.findById(TODAY)).thenReturn(Optional.of(usage(125)));

        DailyUsage usage = budgetService.dailyUsage();

        assertThat(usage.date()).isEqualTo(TODAY);
        assertThat(usage.budgetUsedPercent()).isEqualTo(25);
        assertThat(usage.isOverBudget()).isFalse();
        assertThat(usage.callCount()).isEqualTo(3);
    }

    private static ApiUsage usage(long costCents) {
        return ApiUsage.builder()
                .usageDate(TODAY)
                .inputTokens(10_000)
                .outputTokens(2_000)
                .costCents(costCents)
                .callCount(3)
                .build();
    }
}
