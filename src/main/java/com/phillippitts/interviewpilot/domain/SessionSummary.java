package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal (or current) picture of a session, published on completion.
 *
 * @param sessionId      session identifier
 * @param candidateRef   candidate reference supplied at creation
 * @param jobRef         job reference supplied at creation
 * @param phase          current phase
 * @param startedAt      time {@code start} succeeded, or {@code null}
 * @param deadline       global deadline, or {@code null} before start
 * @param endedAt        time the terminal phase was reached, or {@code null}
 * @param history        exchanges in completion order
 * @param transitions    transition log, including warning entries
 * @param items          plan items with final status
 * @param warnings       recovered conditions such as budget exhaustion
 * @param interruptions  pauses in order
 * @param abortReason    reason when {@code phase == ABORTED}, otherwise {@code null}
 * @param deadlineReached whether the global deadline forced closing
 */
public record SessionSummary(
        String sessionId,
        String candidateRef,
        String jobRef,
        SessionPhase phase,
        Instant startedAt,
        Instant deadline,
        Instant endedAt,
        List<Exchange> history,
        List<TransitionLogEntry> transitions,
        List<PlanItemView> items,
        List<SessionWarning> warnings,
        List<Interruption> interruptions,
        AbortReason abortReason,
        boolean deadlineReached
) {

    public SessionSummary {
        history = List.copyOf(history);
        transitions = List.copyOf(transitions);
        items = List.copyOf(items);
        warnings = List.copyOf(warnings);
        interruptions = List.copyOf(interruptions);
    }

    /** Elapsed interview time, or {@link Duration#ZERO} if the session never started. */
    public Duration elapsed() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    public boolean budgetExhausted() {
        return warnings.stream().anyMatch(w -> w.kind() == FailureKind.BUDGET_EXHAUSTED);
    }

    public Map<String, Integer> followUpCounts() {
        return items.stream().collect(Collectors.toMap(PlanItemView::id, PlanItemView::followUpsIssued));
    }
}
