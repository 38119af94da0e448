package com.phillippitts.interviewpilot.service.speech;

import java.util.Objects;

/**
 * Audio captured for one turn.
 *
 * @param pcm            buffered PCM16LE mono audio
 * @param cause          what ended the turn
 * @param speechDetected whether any chunk was voiced
 */
public record CapturedTurn(byte[] pcm, EndOfTurnCause cause, boolean speechDetected) {

    public CapturedTurn {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(cause, "cause must not be null");
    }
}
