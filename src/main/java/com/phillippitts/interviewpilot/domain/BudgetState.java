package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of the time budget computed by the allocator.
 *
 * @param computedAt     time of the computation
 * @param remaining      time left until the global deadline
 * @param remainingItems number of pending items still to be delivered
 * @param pendingFloor   sum of the minimums of pending items
 * @param targets        allocated target per pending item id
 */
public record BudgetState(
        Instant computedAt,
        Duration remaining,
        int remainingItems,
        Duration pendingFloor,
        Map<String, Duration> targets
) {

    public BudgetState {
        Objects.requireNonNull(computedAt, "computedAt must not be null");
        Objects.requireNonNull(remaining, "remaining must not be null");
        Objects.requireNonNull(pendingFloor, "pendingFloor must not be null");
        targets = targets == null ? Map.of() : Map.copyOf(targets);
    }

    /** Time that can be spent before pending minimums are at risk. */
    public Duration spareTime() {
        Duration spare = remaining.minus(pendingFloor);
        return spare.isNegative() ? Duration.ZERO : spare;
    }

    /** Remaining time as of {@code now}, derived from this snapshot. */
    public Duration remainingAt(Instant now) {
        Duration left = remaining.minus(Duration.between(computedAt, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public static BudgetState empty(Instant at, Duration remaining) {
        return new BudgetState(at, remaining, 0, Duration.ZERO, Map.of());
    }
}
