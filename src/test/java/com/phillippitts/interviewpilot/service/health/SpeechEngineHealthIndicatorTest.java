package com.phillippitts.interviewpilot.service.health;

import com.phillippitts.interviewpilot.service.session.SessionRegistry;
import com.phillippitts.interviewpilot.service.speech.SynthesisEngine;
import com.phillippitts.interviewpilot.service.speech.TranscriptionEngine;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpeechEngineHealthIndicatorTest {

    private EngineWatchdog watchdog;
    private SpeechEngineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        TranscriptionEngine stt = mock(TranscriptionEngine.class);
        SynthesisEngine tts = mock(SynthesisEngine.class);
        when(stt.getEngineName()).thenReturn("stt-http");
        when(tts.getEngineName()).thenReturn("tts-http");
        watchdog = mock(EngineWatchdog.class);
        indicator = new SpeechEngineHealthIndicator(stt, tts, watchdog, new SessionRegistry(5));
    }

    @Test
    void shouldReportUpWhenBothEnginesEnabled() {
        when(watchdog.isEngineEnabled("stt-http")).thenReturn(true);
        when(watchdog.isEngineEnabled("tts-http")).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "All speech engines operational")
                .containsEntry("transcription", "stt-http: enabled")
                .containsEntry("liveSessions", 0);
    }

    @Test
    void shouldReportDegradedWhenOneEngineDisabled() {
        when(watchdog.isEngineEnabled("stt-http")).thenReturn(true);
        when(watchdog.isEngineEnabled("tts-http")).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("synthesis", "tts-http: disabled");
    }

    @Test
    void shouldReportDownWhenBothEnginesDisabled() {
        when(watchdog.isEngineEnabled("stt-http")).thenReturn(false);
        when(watchdog.isEngineEnabled("tts-http")).thenReturn(false);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
