package com.phillippitts.interviewpilot.service.decision;

import java.util.concurrent.CompletableFuture;

/**
 * Estimates how well an answer covers what the question expects.
 *
 * <p>Implementations may be local or remote. The decision engine bounds every call with the
 * scoring timeout and treats failures as "no follow-up".
 */
public interface AnswerScorer {

    CompletableFuture<ScoringResult> score(ScoringRequest request);

    String getName();
}
