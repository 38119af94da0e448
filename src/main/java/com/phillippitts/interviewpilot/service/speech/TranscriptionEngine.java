package com.phillippitts.interviewpilot.service.speech;

import com.phillippitts.interviewpilot.domain.TranscriptionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Speech-to-text engine.
 *
 * <p>Implementations must be thread-safe; several sessions transcribe concurrently. Cancelling the
 * returned future must abort the underlying request where the transport allows it.
 */
public interface TranscriptionEngine {

    /**
     * Transcribes one turn of audio.
     *
     * @param pcm PCM16LE mono 16 kHz audio
     * @return future completed with the transcript, or failed with
     *         {@link com.phillippitts.interviewpilot.exception.SpeechException}
     */
    CompletableFuture<TranscriptionResult> transcribe(byte[] pcm);

    /** Engine identifier used in logs, metrics and failure events. */
    String getEngineName();
}
