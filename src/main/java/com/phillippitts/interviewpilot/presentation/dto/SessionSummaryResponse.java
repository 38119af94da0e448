package com.phillippitts.interviewpilot.presentation.dto;

import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.Interruption;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.domain.SessionWarning;
import com.phillippitts.interviewpilot.domain.TransitionLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST view of a session summary. Decisions are flattened to kind and detail so that clients do not
 * need to know the decision variants.
 */
public record SessionSummaryResponse(
        String sessionId,
        String candidateRef,
        String jobRef,
        SessionPhase phase,
        Instant startedAt,
        Instant deadline,
        Instant endedAt,
        long elapsedSeconds,
        boolean deadlineReached,
        boolean budgetExhausted,
        String abortReason,
        Map<String, Integer> followUps,
        List<ExchangeView> history,
        List<PlanItemView> items,
        List<SessionWarning> warnings,
        List<Interruption> interruptions,
        List<TransitionLogEntry> transitions
) {

    public static SessionSummaryResponse from(SessionSummary summary) {
        return new SessionSummaryResponse(
                summary.sessionId(),
                summary.candidateRef(),
                summary.jobRef(),
                summary.phase(),
                summary.startedAt(),
                summary.deadline(),
                summary.endedAt(),
                summary.elapsed().toSeconds(),
                summary.deadlineReached(),
                summary.budgetExhausted(),
                summary.abortReason() == null ? null : summary.abortReason().cause().name(),
                summary.followUpCounts(),
                summary.history().stream().map(ExchangeView::from).toList(),
                summary.items(),
                summary.warnings(),
                summary.interruptions(),
                summary.transitions());
    }

    public record ExchangeView(
            String itemId,
            int round,
            String question,
            String transcript,
            String decision,
            String detail,
            long elapsedMillis,
            Instant timestamp
    ) {

        static ExchangeView from(Exchange exchange) {
            return new ExchangeView(exchange.itemId(), exchange.round(), exchange.question(), exchange.transcript(),
                    exchange.decision().kind().name(), detail(exchange.decision()),
                    exchange.elapsed().toMillis(), exchange.timestamp());
        }

        private static String detail(Decision decision) {
            return decision instanceof Decision.FollowUp followUp ? followUp.text() : decision.reason();
        }
    }
}
