package com.phillippitts.interviewpilot.service.speech.http;

import com.phillippitts.interviewpilot.domain.TranscriptionResult;
import com.phillippitts.interviewpilot.exception.SpeechException;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.speech.TranscriptionEngine;
import com.phillippitts.interviewpilot.service.speech.WavWriter;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Transcription engine backed by an HTTP speech-to-text service.
 *
 * <p>Request: {@code POST <path>} with an {@code audio/wav} body. Response: JSON
 * {@code {"text": "...", "confidence": 0.93}}; a missing text field is an empty transcript and a
 * missing confidence defaults to 1.0.
 *
 * <p>The returned future is backed by the reactive request, so cancelling it cancels the call.
 */
public class WebClientTranscriptionEngine implements TranscriptionEngine {

    static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final WebClient webClient;
    private final String path;
    private final String engineName;
    private final InterviewClock clock;

    public WebClientTranscriptionEngine(WebClient webClient, String path, String engineName, InterviewClock clock) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.engineName = Objects.requireNonNull(engineName, "engineName must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CompletableFuture<TranscriptionResult> transcribe(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        return webClient.post()
                .uri(path)
                .contentType(AUDIO_WAV)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(WavWriter.toWav(pcm))
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("{}")
                .map(this::parse)
                .onErrorMap(e -> !(e instanceof SpeechException),
                        e -> new SpeechException("Transcription request failed", engineName, e))
                .toFuture();
    }

    TranscriptionResult parse(String body) {
        try {
            JSONObject json = new JSONObject(body);
            String text = json.optString("text", "").trim();
            double confidence = json.optDouble("confidence", 1.0);
            if (Double.isNaN(confidence)) {
                confidence = 1.0;
            }
            confidence = Math.max(0.0, Math.min(1.0, confidence));
            return TranscriptionResult.of(text, confidence, engineName, clock.now());
        } catch (JSONException e) {
            throw new SpeechException("Malformed transcription response", engineName, e);
        }
    }

    @Override
    public String getEngineName() {
        return engineName;
    }
}
