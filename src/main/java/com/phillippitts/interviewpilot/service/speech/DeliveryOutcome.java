package com.phillippitts.interviewpilot.service.speech;

/**
 * How a prompt reached the candidate.
 */
public enum DeliveryOutcome {
    /** Audio was synthesized and streamed in full. */
    SPOKEN,
    /** Synthesis failed or timed out; the candidate has the text only. */
    TEXT_ONLY,
    /** The session cancelled the delivery (deadline or abort). */
    CANCELLED
}
