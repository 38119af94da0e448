package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.exception.ScoringException;
import com.phillippitts.interviewpilot.service.async.CancellationScope;
import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Rule-ordered follow-up decisions.
 *
 * <ol>
 *   <li>No answer → {@code ForceAdvance("no-answer")}</li>
 *   <li>Another round would not fit the item cap or the pending minimums →
 *       {@code ForceAdvance("budget")}, whatever the answer</li>
 *   <li>Follow-up depth used up → {@code Advance("depth-exhausted")} without scoring</li>
 *   <li>Scoring fails or times out → {@code Advance("scoring-unavailable")}</li>
 *   <li>Coverage at or above the threshold → {@code Advance("covered")}</li>
 *   <li>Otherwise {@code FollowUp} with the scorer's text or one built from the uncovered points</li>
 * </ol>
 */
public class DefaultFollowUpDecisionEngine implements FollowUpDecisionEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultFollowUpDecisionEngine.class);

    private final AnswerScorer scorer;
    private final DecisionPolicy policy;
    private final TimedCalls timedCalls;
    private final InterviewMetricsPublisher metrics;

    public DefaultFollowUpDecisionEngine(AnswerScorer scorer, DecisionPolicy policy, TimedCalls timedCalls,
                                         InterviewMetricsPublisher metrics) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.timedCalls = Objects.requireNonNull(timedCalls, "timedCalls must not be null");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
    }

    @Override
    public CompletableFuture<Decision> decide(DecisionRequest request, CancellationScope scope) {
        Objects.requireNonNull(request, "request must not be null");
        if (TranscriptionResult.isNoAnswer(request.transcript())) {
            return done(Decision.forceAdvance("no-answer"));
        }
        if (request.availableForAnotherRound().compareTo(policy.minCost()) < 0) {
            LOG.debug("No time for another round on {}: available={}", request.itemId(),
                    request.availableForAnotherRound());
            return done(Decision.forceAdvance("budget"));
        }
        if (request.followUpsIssued() >= policy.maxDepth()) {
            return done(Decision.advance("depth-exhausted"));
        }

        ScoringRequest scoring = new ScoringRequest(request.roundQuestion() == null ? "" : request.roundQuestion(),
                request.transcript(), request.rubric(), request.type());
        return timedCalls.call(
                        () -> scorer.score(scoring),
                        policy.scoringTimeout(),
                        scope,
                        () -> new ScoringException("Scoring timed out after " + policy.scoringTimeout(), true))
                .handle((result, error) -> {
                    if (error == null) {
                        return toDecision(request, result);
                    }
                    Throwable cause = TimedCalls.unwrap(error);
                    if (cause instanceof CancellationException cancelled) {
                        throw cancelled;
                    }
                    String reason = cause instanceof ScoringException se && se.isTimeout() ? "timeout" : "error";
                    LOG.warn("Scoring failed for item {} via {}: reason={}, error={}",
                            request.itemId(), scorer.getName(), reason, cause.toString());
                    metrics.scoringFailure(reason);
                    return (Decision) Decision.advance("scoring-unavailable");
                });
    }

    private Decision toDecision(DecisionRequest request, ScoringResult result) {
        LOG.debug("Item {} coverage={} threshold={}", request.itemId(), result.coverage(),
                policy.coverageThreshold());
        if (result.coverage() >= policy.coverageThreshold()) {
            return Decision.advance("covered");
        }
        String text = result.followUp().orElseGet(() -> FollowUpPrompts.build(request.type(), result.missingPoints()));
        return Decision.followUp(text);
    }

    private static CompletableFuture<Decision> done(Decision decision) {
        return CompletableFuture.completedFuture(decision);
    }
}
