package com.phillippitts.interviewpilot.service.speech;

import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.service.async.CancellationScope;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform async access to speech synthesis and transcription.
 *
 * <p>Every call takes a timeout and the owning session's {@link CancellationScope}. On timeout the
 * underlying engine call is cancelled before the returned future fails.
 */
public interface SpeechIoAdapter {

    /**
     * Synthesizes {@code text} and streams the audio to {@code sink}.
     *
     * <p>Never fails: synthesis errors and timeouts yield {@link DeliveryOutcome#TEXT_ONLY}, a
     * cancelled scope yields {@link DeliveryOutcome#CANCELLED}.
     */
    CompletableFuture<DeliveryOutcome> speak(String text, AudioSink sink, Duration timeout, CancellationScope scope);

    /**
     * Waits for the end of turn in {@code window}, then transcribes the captured audio.
     *
     * <p>A turn without detected speech completes with the no-answer sentinel without calling the
     * engine. The timeout covers the engine call only, not the time the candidate takes to answer.
     *
     * @return future completed with the transcript, or failed with
     *         {@link com.phillippitts.interviewpilot.exception.SpeechTimeoutException},
     *         {@link com.phillippitts.interviewpilot.exception.SpeechException} or a cancellation
     */
    CompletableFuture<TranscriptionResult> transcribe(ListeningWindow window, Duration timeout, CancellationScope scope);
}
