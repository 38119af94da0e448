package com.phillippitts.interviewpilot.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetStateTest {

    private static final Instant AT = Instant.parse("2026-01-05T09:00:00Z");

    @Test
    void spareTimeIsRemainingMinusFloorAndNeverNegative() {
        BudgetState budget = new BudgetState(AT, Duration.ofMinutes(10), 2, Duration.ofMinutes(6), Map.of());
        BudgetState tight = new BudgetState(AT, Duration.ofMinutes(4), 2, Duration.ofMinutes(6), Map.of());

        assertThat(budget.spareTime()).isEqualTo(Duration.ofMinutes(4));
        assertThat(tight.spareTime()).isZero();
    }

    @Test
    void remainingAtDerivesFromSnapshot() {
        BudgetState budget = new BudgetState(AT, Duration.ofMinutes(10), 1, Duration.ZERO, null);

        assertThat(budget.remainingAt(AT.plusSeconds(90))).isEqualTo(Duration.ofSeconds(510));
        assertThat(budget.remainingAt(AT.plus(Duration.ofHours(1)))).isZero();
        assertThat(budget.targets()).isEmpty();
    }

    @Test
    void emptyBudgetHasNoItems() {
        BudgetState budget = BudgetState.empty(AT, Duration.ofMinutes(3));

        assertThat(budget.remainingItems()).isZero();
        assertThat(budget.spareTime()).isEqualTo(Duration.ofMinutes(3));
    }
}
