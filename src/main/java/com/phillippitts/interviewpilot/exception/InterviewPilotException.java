package com.phillippitts.interviewpilot.exception;

/**
 * Base exception for all interviewpilot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class InterviewPilotException extends RuntimeException {

    public InterviewPilotException(String message) {
        super(message);
    }

    public InterviewPilotException(String message, Throwable cause) {
        super(message, cause);
    }

    public InterviewPilotException(Throwable cause) {
        super(cause);
    }
}
