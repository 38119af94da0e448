package com.phillippitts.interviewpilot.service.speech.http;

import com.phillippitts.interviewpilot.exception.SpeechException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientSynthesisEngineTest {

    private MockWebServer server;
    private WebClientSynthesisEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        WebClient webClient = WebClient.builder().baseUrl(server.url("/").toString()).build();
        engine = new WebClientSynthesisEngine(webClient, "/v1/speak", "alloy", "tts-http");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void streamsPcmBodyAsChunks() throws Exception {
        byte[] pcm = new byte[16000];
        for (int i = 0; i < pcm.length; i++) {
            pcm[i] = (byte) i;
        }
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/octet-stream")
                .setBody(new Buffer().write(pcm)));

        ByteArrayOutputStream received = new ByteArrayOutputStream();
        for (byte[] chunk : engine.synthesize("Tell me about yourself.")) {
            received.write(chunk);
        }

        assertThat(received.toByteArray()).isEqualTo(pcm);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/v1/speak");
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertThat(body.getString("text")).isEqualTo("Tell me about yourself.");
        assertThat(body.getString("voice")).isEqualTo("alloy");
        assertThat(body.getString("format")).isEqualTo("pcm_s16le_16000");
    }

    @Test
    void blankTextIssuesNoRequest() {
        assertThat(engine.synthesize("  ")).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void serverErrorSurfacesWhileIterating() {
        server.enqueue(new MockResponse().setResponseCode(500));

        Iterable<byte[]> audio = engine.synthesize("Hello");

        assertThatThrownBy(() -> audio.iterator().hasNext())
                .isInstanceOf(SpeechException.class)
                .hasMessageContaining("Synthesis request failed");
    }
}
