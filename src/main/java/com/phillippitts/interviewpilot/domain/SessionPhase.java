package com.phillippitts.interviewpilot.domain;

/**
 * Phases of an interview session.
 *
 * <pre>
 * CREATED → GREETING → DELIVERING → LISTENING → DECIDING → FOLLOWING_UP | ADVANCING
 * FOLLOWING_UP → LISTENING
 * ADVANCING → DELIVERING | CLOSING
 * CLOSING → COMPLETED
 * any non-terminal → ABORTED
 * </pre>
 */
public enum SessionPhase {
    CREATED,
    GREETING,
    DELIVERING,
    LISTENING,
    DECIDING,
    FOLLOWING_UP,
    ADVANCING,
    CLOSING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    /** Phases in which a plan item is bound to the session. */
    public boolean isItemBound() {
        return this == DELIVERING || this == LISTENING || this == DECIDING
                || this == FOLLOWING_UP || this == ADVANCING;
    }
}
