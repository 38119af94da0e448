package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one question/answer round.
 *
 * <p>Round 0 is the plan item's own question; rounds 1..n are follow-ups on the same item.
 * An empty transcript means no answer was captured (see {@link TranscriptionResult#NO_ANSWER}).
 *
 * @param itemId     plan item the round belongs to
 * @param round      0 for the primary question, incremented per follow-up
 * @param question   text delivered in this round
 * @param transcript candidate answer, never null
 * @param decision   verdict taken after the answer
 * @param elapsed    time from the start of delivery to the decision
 * @param timestamp  when the round was closed
 */
public record Exchange(
        String itemId,
        int round,
        String question,
        String transcript,
        Decision decision,
        Duration elapsed,
        Instant timestamp
) {

    public Exchange {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must not be negative: " + elapsed);
        }
    }

    public boolean hasAnswer() {
        return !TranscriptionResult.isNoAnswer(transcript);
    }
}
