package com.phillippitts.interviewpilot.service.speech;

public enum EndOfTurnCause {
    /** Trailing silence reached the configured duration after speech. */
    SILENCE,
    /** The candidate or an operator signalled the end of the answer. */
    EXPLICIT,
    /** The plan item's maximum time ran out. */
    ITEM_LIMIT,
    /** The buffered turn reached its maximum length. */
    MAX_LENGTH
}
