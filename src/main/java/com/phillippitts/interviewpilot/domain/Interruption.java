package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * A pause requested by the candidate. {@code resumedAt} is {@code null} while still paused.
 */
public record Interruption(Instant pausedAt, Instant resumedAt, String note) {

    public Duration length(Instant now) {
        return Duration.between(pausedAt, resumedAt == null ? now : resumedAt);
    }

    public Interruption resume(Instant at) {
        return new Interruption(pausedAt, at, note);
    }
}
