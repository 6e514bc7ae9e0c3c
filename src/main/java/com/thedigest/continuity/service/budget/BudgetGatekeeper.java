package com.thedigest.continuity.service.budget;

import com.thedigest.continuity.dto.DailyUsage;

/**
 * Decides whether another paid generation call may be made and keeps the ledger.
 */
public interface BudgetGatekeeper {

    /**
     * @return true when a generation call is currently allowed
     */
    boolean allowCall();

    /**
     * Reports the token usage of a completed generation call.
     */
    void recordUsage(int inputTokens, int outputTokens);

    /**
     * @return today's usage against the budget
     */
    DailyUsage dailyUsage();
}
