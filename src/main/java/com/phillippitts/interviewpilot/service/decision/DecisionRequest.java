package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.QuestionType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything the decision engine needs about the round that just ended.
 *
 * @param itemId          active plan item
 * @param itemQuestion    the item's primary question
 * @param roundQuestion   text delivered in this round (primary question or follow-up)
 * @param transcript      candidate answer, empty when nothing was captured
 * @param rubric          item rubric
 * @param type            item type
 * @param itemElapsed     time spent on the item so far
 * @param itemMax         per-item cap
 * @param followUpsIssued follow-ups already asked on the item
 * @param budget          latest budget snapshot
 * @param now             time of the request
 */
public record DecisionRequest(
        String itemId,
        String itemQuestion,
        String roundQuestion,
        String transcript,
        List<String> rubric,
        QuestionType type,
        Duration itemElapsed,
        Duration itemMax,
        int followUpsIssued,
        BudgetState budget,
        Instant now
) {

    public DecisionRequest {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(itemElapsed, "itemElapsed must not be null");
        Objects.requireNonNull(itemMax, "itemMax must not be null");
        Objects.requireNonNull(budget, "budget must not be null");
        Objects.requireNonNull(now, "now must not be null");
        transcript = transcript == null ? "" : transcript;
        rubric = rubric == null ? List.of() : List.copyOf(rubric);
    }

    /** Time one more round on this item could use without breaking the item cap or pending minimums. */
    public Duration availableForAnotherRound() {
        Duration itemLeft = itemMax.minus(itemElapsed);
        Duration globalLeft = budget.remainingAt(now).minus(budget.pendingFloor());
        Duration available = itemLeft.compareTo(globalLeft) < 0 ? itemLeft : globalLeft;
        return available.isNegative() ? Duration.ZERO : available;
    }
}
