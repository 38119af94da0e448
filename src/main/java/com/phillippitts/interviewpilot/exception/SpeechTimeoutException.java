package com.phillippitts.interviewpilot.exception;

import java.time.Duration;

/**
 * Thrown when a transcription or synthesis call exceeds its timeout.
 * The underlying engine call has been cancelled by the time this is raised.
 */
public class SpeechTimeoutException extends SpeechException {

    private final Duration timeout;

    public SpeechTimeoutException(String operation, String engineName, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + "ms", engineName);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
