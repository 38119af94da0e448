package com.phillippitts.interviewpilot.exception;

/**
 * Thrown when a transcription or synthesis call fails.
 * This may occur due to engine errors, transport failures, or a disabled engine.
 */
public class SpeechException extends InterviewPilotException {

    private final String engineName;

    public SpeechException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public SpeechException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SpeechException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
