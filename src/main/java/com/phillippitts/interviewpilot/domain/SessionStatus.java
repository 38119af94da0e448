package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Live view of a session for status queries.
 */
public record SessionStatus(
        String sessionId,
        String candidateRef,
        String jobRef,
        SessionPhase phase,
        boolean paused,
        Instant startedAt,
        Instant deadline,
        Duration remaining,
        String activeItemId,
        List<PlanItemView> items,
        int exchanges
) {

    public SessionStatus {
        items = List.copyOf(items);
    }
}
