package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.service.async.CancellationScope;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether to advance, force-advance or ask a follow-up after an answer.
 */
public interface FollowUpDecisionEngine {

    /**
     * @param request round context
     * @param scope   session cancellation scope; cancelling it cancels an in-flight scoring call
     * @return the decision; completes exceptionally only with a cancellation
     */
    CompletableFuture<Decision> decide(DecisionRequest request, CancellationScope scope);
}
