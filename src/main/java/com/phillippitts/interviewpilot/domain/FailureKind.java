package com.phillippitts.interviewpilot.domain;

/**
 * Error taxonomy of the orchestrator.
 *
 * <p>Only {@link #INVALID_PLAN} and {@link #ABORTED} are visible to callers as hard failures.
 * The rest are recovered inside the owning component and show up as warnings or decisions.
 */
public enum FailureKind {
    INVALID_PLAN,
    SPEECH_TIMEOUT,
    SCORING_FAILURE,
    BUDGET_EXHAUSTED,
    DEADLINE_EXCEEDED,
    ABORTED
}
