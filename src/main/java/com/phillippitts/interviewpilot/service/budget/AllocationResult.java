package com.phillippitts.interviewpilot.service.budget;

import com.phillippitts.interviewpilot.domain.BudgetState;

import java.util.List;
import java.util.Objects;

/**
 * Output of one allocator run.
 *
 * @param budget  budget snapshot including the new targets of surviving items
 * @param skipped ids of pending items dropped because their minimums did not fit, in skip order
 */
public record AllocationResult(BudgetState budget, List<String> skipped) {

    public AllocationResult {
        Objects.requireNonNull(budget, "budget must not be null");
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /** True when the allocator had to skip items to keep minimums within the remaining time. */
    public boolean budgetExhausted() {
        return !skipped.isEmpty();
    }
}
