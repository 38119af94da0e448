package com.phillippitts.interviewpilot.exception;

/**
 * Thrown when the answer-scoring call fails or times out.
 * Never escapes the decision engine, which fails open.
 */
public class ScoringException extends InterviewPilotException {

    private final boolean timeout;

    public ScoringException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
