package com.phillippitts.interviewpilot.service.speech.http;

import com.phillippitts.interviewpilot.exception.SpeechException;
import com.phillippitts.interviewpilot.service.speech.SynthesisEngine;
import org.json.JSONObject;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Synthesis engine backed by an HTTP text-to-speech service that streams raw PCM.
 *
 * <p>Request: {@code POST <path>} with JSON {@code {"text", "voice", "format": "pcm_s16le_16000"}}.
 * The response body is consumed chunk by chunk as it arrives.
 */
public class WebClientSynthesisEngine implements SynthesisEngine {

    static final String FORMAT = "pcm_s16le_16000";

    private final WebClient webClient;
    private final String path;
    private final String voice;
    private final String engineName;

    public WebClientSynthesisEngine(WebClient webClient, String path, String voice, String engineName) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.voice = voice == null ? "default" : voice;
        this.engineName = Objects.requireNonNull(engineName, "engineName must not be null");
    }

    @Override
    public Iterable<byte[]> synthesize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String payload = new JSONObject()
                .put("text", text)
                .put("voice", voice)
                .put("format", FORMAT)
                .toString();

        // Cold publisher: every subscription issues a new request
        Flux<DataBuffer> data = webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(DataBuffer.class)
                .onErrorMap(e -> new SpeechException("Synthesis request failed", engineName, e));

        return () -> toByteIterator(data);
    }

    private Iterator<byte[]> toByteIterator(Flux<DataBuffer> data) {
        return data.toStream()
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .iterator();
    }

    @Override
    public String getEngineName() {
        return engineName;
    }
}
