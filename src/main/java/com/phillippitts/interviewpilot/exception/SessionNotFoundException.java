package com.phillippitts.interviewpilot.exception;

/**
 * Thrown when a session id is neither live nor archived.
 */
public class SessionNotFoundException extends InterviewPilotException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
