package com.phillippitts.interviewpilot.service.session;

import java.time.Duration;
import java.util.Objects;

/**
 * A registered session that has not terminated yet. Its plan is staged on the conductor's state machine.
 *
 * @param conductor drives the session
 * @param length    interview length; the deadline is {@code start + length}
 */
public record LiveSession(InterviewConductor conductor, Duration length) {

    public LiveSession {
        Objects.requireNonNull(conductor, "conductor must not be null");
        Objects.requireNonNull(length, "length must not be null");
    }

    public String sessionId() {
        return conductor.getSessionId();
    }
}
