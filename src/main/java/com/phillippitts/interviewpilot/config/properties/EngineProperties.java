package com.phillippitts.interviewpilot.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Endpoints of the external subsystems ({@code engines.*}).
 */
@Validated
@ConfigurationProperties(prefix = "engines")
public class EngineProperties {

    @Valid
    private Endpoint transcription = new Endpoint("http://localhost:9001", "/v1/transcribe", "remote-stt");

    @Valid
    private Endpoint synthesis = new Endpoint("http://localhost:9002", "/v1/synthesize", "remote-tts");

    @Valid
    private Endpoint scoring = new Endpoint("http://localhost:9003", "/v1/score", "remote-scorer");

    @Valid
    private Endpoint planSource = new Endpoint("http://localhost:9004", "/v1/plans", "plan-source");

    public Endpoint getTranscription() {
        return transcription;
    }

    public void setTranscription(Endpoint transcription) {
        this.transcription = transcription;
    }

    public Endpoint getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Endpoint synthesis) {
        this.synthesis = synthesis;
    }

    public Endpoint getScoring() {
        return scoring;
    }

    public void setScoring(Endpoint scoring) {
        this.scoring = scoring;
    }

    public Endpoint getPlanSource() {
        return planSource;
    }

    public void setPlanSource(Endpoint planSource) {
        this.planSource = planSource;
    }

    /**
     * One HTTP endpoint.
     */
    public static class Endpoint {
        @NotBlank
        private String baseUrl;
        @NotBlank
        private String path;
        @NotBlank
        private String name;
        /** Voice id, synthesis only. */
        private String voice = "default";
        /** Used by blocking calls; async calls use the interview timeouts. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        public Endpoint() {
        }

        public Endpoint(String baseUrl, String path, String name) {
            this.baseUrl = baseUrl;
            this.path = path;
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
