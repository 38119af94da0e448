package com.phillippitts.interviewpilot.domain;

import java.time.Instant;

/**
 * One line of a session's transition log. Warnings are logged with {@code from == to}.
 *
 * @param sequence monotonically increasing per session, starting at 1
 * @param at       when the entry was recorded
 * @param from     phase before the transition
 * @param to       phase after the transition
 * @param itemId   plan item bound at the time, or {@code null}
 * @param note     short description
 */
public record TransitionLogEntry(
        long sequence,
        Instant at,
        SessionPhase from,
        SessionPhase to,
        String itemId,
        String note
) {

    public boolean isTransition() {
        return from != to;
    }
}
