package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.config.properties.InterviewProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-session timing and wording used by {@link InterviewConductor}.
 */
public record ConductorSettings(
        String greeting,
        String closing,
        Duration synthesisTimeout,
        Duration transcriptionTimeout,
        Duration closingGrace,
        Duration silenceDuration,
        int silenceThreshold,
        Duration maxTurn
) {

    public ConductorSettings {
        greeting = greeting == null ? "" : greeting;
        closing = closing == null ? "" : closing;
        Objects.requireNonNull(synthesisTimeout, "synthesisTimeout must not be null");
        Objects.requireNonNull(transcriptionTimeout, "transcriptionTimeout must not be null");
        Objects.requireNonNull(closingGrace, "closingGrace must not be null");
        Objects.requireNonNull(silenceDuration, "silenceDuration must not be null");
        Objects.requireNonNull(maxTurn, "maxTurn must not be null");
    }

    public static ConductorSettings from(InterviewProperties properties) {
        InterviewProperties.Speech speech = properties.getSpeech();
        InterviewProperties.Timeouts timeouts = properties.getTimeouts();
        return new ConductorSettings(properties.getGreeting(), properties.getClosing(), timeouts.getSynthesis(),
                timeouts.getTranscription(), properties.getClosingGrace(), speech.getSilenceDuration(),
                speech.getSilenceThreshold(), speech.getMaxTurn());
    }
}
