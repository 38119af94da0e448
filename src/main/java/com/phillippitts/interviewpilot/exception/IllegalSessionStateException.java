package com.phillippitts.interviewpilot.exception;

import com.phillippitts.interviewpilot.domain.SessionPhase;

/**
 * Thrown when a control signal cannot be applied in the session's current phase,
 * for example starting a session twice or pausing a finished one.
 */
public class IllegalSessionStateException extends InterviewPilotException {

    private final SessionPhase phase;

    public IllegalSessionStateException(String message, SessionPhase phase) {
        super(message + " (phase: " + phase + ")");
        this.phase = phase;
    }

    public SessionPhase getPhase() {
        return phase;
    }
}
