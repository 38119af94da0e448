package com.phillippitts.interviewpilot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of a speech-to-text call.
 *
 * @param text       the transcribed text (never null, may be empty)
 * @param confidence confidence score between 0.0 and 1.0
 * @param timestamp  when the transcription was completed
 * @param engineName name of the engine that produced the result
 */
public record TranscriptionResult(
        String text,
        double confidence,
        Instant timestamp,
        String engineName
) {

    /** Sentinel transcript for a turn where no answer was captured. */
    public static final String NO_ANSWER = "";

    /**
     * Compact constructor with validation.
     *
     * <p>Note: Empty text is valid. Silence or an expired turn produce no transcription.
     *
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if text, timestamp, or engineName is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, String engineName, Instant at) {
        return new TranscriptionResult(text, confidence, at, engineName);
    }

    public static TranscriptionResult noAnswer(String engineName, Instant at) {
        return new TranscriptionResult(NO_ANSWER, 0.0, at, engineName);
    }

    public static boolean isNoAnswer(String transcript) {
        return transcript == null || transcript.isBlank();
    }
}
